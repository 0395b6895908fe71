/*
 * Where: escalation data access
 * What: crisis_alerts and crisis_escalation_logs on PostgreSQL
 * Why: conditional UPDATEs make status moves and the first-responder claim atomic across instances
 */
package com.serenity.escalation.repository;

import static com.serenity.common.JdbcTimestampUtils.toInstant;
import static com.serenity.common.JdbcTimestampUtils.toTimestamp;

import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.EscalationLogRecord;
import com.serenity.escalation.model.EscalationReason;
import com.serenity.escalation.model.Severity;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcCrisisAlertRepository implements CrisisAlertRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT crisis_alert_id, request_id, severity, status, tier, responder_count,
             first_responder_id, escalation_level, escalation_deadline, expires_at,
             resolution, tiers_exhausted, created_at, updated_at
      FROM crisis_alerts
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(CrisisAlertRecord record) {
    final String sql =
        """
        INSERT INTO crisis_alerts (
          crisis_alert_id,
          request_id,
          severity,
          status,
          tier,
          responder_count,
          first_responder_id,
          escalation_level,
          escalation_deadline,
          expires_at,
          resolution,
          tiers_exhausted,
          created_at,
          updated_at
        ) VALUES (
          :crisisAlertId,
          :requestId,
          :severity,
          :status,
          :tier,
          :responderCount,
          :firstResponderId,
          :escalationLevel,
          :escalationDeadline,
          :expiresAt,
          :resolution,
          :tiersExhausted,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("crisisAlertId", record.crisisAlertId())
            .addValue("requestId", record.requestId())
            .addValue("severity", record.severity().name())
            .addValue("status", record.status().name())
            .addValue("tier", record.tier())
            .addValue("responderCount", record.responderCount())
            .addValue("firstResponderId", record.firstResponderId())
            .addValue("escalationLevel", record.escalationLevel())
            .addValue("escalationDeadline", toTimestamp(record.escalationDeadline()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()))
            .addValue("resolution", record.resolution())
            .addValue("tiersExhausted", record.tiersExhausted())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<CrisisAlertRecord> findById(UUID crisisAlertId) {
    final String sql = SELECT_COLUMNS + "WHERE crisis_alert_id = :crisisAlertId";
    return jdbcTemplate
        .query(
            sql, new MapSqlParameterSource().addValue("crisisAlertId", crisisAlertId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<CrisisAlertRecord> findByRequestId(UUID requestId) {
    final String sql = SELECT_COLUMNS + "WHERE request_id = :requestId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("requestId", requestId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public List<CrisisAlertRecord> findOpen(int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status IN ('SCHEDULED', 'SENT', 'ESCALATED', 'ACKNOWLEDGED')
            ORDER BY COALESCE(escalation_deadline, expires_at)
            LIMIT :limit
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("limit", limit), this::mapRow);
  }

  @Override
  public int transition(
      UUID crisisAlertId, Set<CrisisAlertStatus> from, CrisisAlertStatus target, Instant now) {
    final String sql =
        """
        UPDATE crisis_alerts
        SET status = :target,
            updated_at = :now
        WHERE crisis_alert_id = :crisisAlertId
          AND status IN (:from)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("target", target.name())
            .addValue("now", toTimestamp(now))
            .addValue("crisisAlertId", crisisAlertId)
            .addValue("from", names(from));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int close(
      UUID crisisAlertId,
      Set<CrisisAlertStatus> from,
      CrisisAlertStatus target,
      String resolution,
      Instant now) {
    final String sql =
        """
        UPDATE crisis_alerts
        SET status = :target,
            resolution = :resolution,
            escalation_deadline = NULL,
            updated_at = :now
        WHERE crisis_alert_id = :crisisAlertId
          AND status IN (:from)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("target", target.name())
            .addValue("resolution", resolution)
            .addValue("now", toTimestamp(now))
            .addValue("crisisAlertId", crisisAlertId)
            .addValue("from", names(from));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int escalate(
      UUID crisisAlertId, int expectedTier, int newTier, Instant deadline, Instant now) {
    final String sql =
        """
        UPDATE crisis_alerts
        SET tier = :newTier,
            escalation_level = escalation_level + 1,
            status = 'ESCALATED',
            escalation_deadline = :deadline,
            updated_at = :now
        WHERE crisis_alert_id = :crisisAlertId
          AND tier = :expectedTier
          AND status IN ('SCHEDULED', 'SENT', 'ESCALATED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("newTier", newTier)
            .addValue("deadline", toTimestamp(deadline))
            .addValue("now", toTimestamp(now))
            .addValue("crisisAlertId", crisisAlertId)
            .addValue("expectedTier", expectedTier);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int updateDeadline(UUID crisisAlertId, Instant deadline, Instant now) {
    final String sql =
        """
        UPDATE crisis_alerts
        SET escalation_deadline = :deadline,
            updated_at = :now
        WHERE crisis_alert_id = :crisisAlertId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deadline", toTimestamp(deadline))
            .addValue("now", toTimestamp(now))
            .addValue("crisisAlertId", crisisAlertId);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int claimFirstResponder(UUID crisisAlertId, String responderId, Instant now) {
    final String sql =
        """
        UPDATE crisis_alerts
        SET first_responder_id = :responderId,
            updated_at = :now
        WHERE crisis_alert_id = :crisisAlertId
          AND first_responder_id IS NULL
          AND status NOT IN ('RESOLVED', 'CANCELLED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("responderId", responderId)
            .addValue("now", toTimestamp(now))
            .addValue("crisisAlertId", crisisAlertId);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int incrementResponderCount(UUID crisisAlertId, Instant now) {
    final String sql =
        """
        UPDATE crisis_alerts
        SET responder_count = responder_count + 1,
            updated_at = :now
        WHERE crisis_alert_id = :crisisAlertId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("crisisAlertId", crisisAlertId);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markTiersExhausted(UUID crisisAlertId, Instant now) {
    final String sql =
        """
        UPDATE crisis_alerts
        SET tiers_exhausted = TRUE,
            updated_at = :now
        WHERE crisis_alert_id = :crisisAlertId
          AND tiers_exhausted = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("crisisAlertId", crisisAlertId);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public long countActive() {
    final String sql =
        """
        SELECT COUNT(*)
        FROM crisis_alerts
        WHERE status IN ('SCHEDULED', 'SENT', 'ESCALATED', 'ACKNOWLEDGED')
        """;
    final Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  @Override
  public void insertEscalationLog(EscalationLogRecord record) {
    final String sql =
        """
        INSERT INTO crisis_escalation_logs (
          log_id, crisis_alert_id, previous_tier, new_tier, reason, escalated_at
        ) VALUES (
          :logId, :crisisAlertId, :previousTier, :newTier, :reason, :escalatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("logId", record.logId())
            .addValue("crisisAlertId", record.crisisAlertId())
            .addValue("previousTier", record.previousTier())
            .addValue("newTier", record.newTier())
            .addValue("reason", record.reason().value())
            .addValue("escalatedAt", toTimestamp(record.escalatedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<EscalationLogRecord> findEscalationLogs(UUID crisisAlertId) {
    final String sql =
        """
        SELECT log_id, crisis_alert_id, previous_tier, new_tier, reason, escalated_at
        FROM crisis_escalation_logs
        WHERE crisis_alert_id = :crisisAlertId
        ORDER BY escalated_at, new_tier
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("crisisAlertId", crisisAlertId),
        (rs, rowNum) ->
            new EscalationLogRecord(
                UUID.fromString(rs.getString("log_id")),
                UUID.fromString(rs.getString("crisis_alert_id")),
                rs.getInt("previous_tier"),
                rs.getInt("new_tier"),
                EscalationReason.fromValue(rs.getString("reason")),
                toInstant(rs.getTimestamp("escalated_at"))));
  }

  @Override
  public int deleteEscalationLogsOlderThan(Instant threshold) {
    final String sql = "DELETE FROM crisis_escalation_logs WHERE escalated_at < :threshold";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  private List<String> names(Set<CrisisAlertStatus> statuses) {
    return statuses.stream().map(Enum::name).toList();
  }

  private CrisisAlertRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return CrisisAlertRecord.builder()
        .crisisAlertId(UUID.fromString(rs.getString("crisis_alert_id")))
        .requestId(UUID.fromString(rs.getString("request_id")))
        .severity(Severity.valueOf(rs.getString("severity")))
        .status(CrisisAlertStatus.valueOf(rs.getString("status")))
        .tier(rs.getInt("tier"))
        .responderCount(rs.getInt("responder_count"))
        .firstResponderId(rs.getString("first_responder_id"))
        .escalationLevel(rs.getInt("escalation_level"))
        .escalationDeadline(toInstant(rs.getTimestamp("escalation_deadline")))
        .expiresAt(toInstant(rs.getTimestamp("expires_at")))
        .resolution(rs.getString("resolution"))
        .tiersExhausted(rs.getBoolean("tiers_exhausted"))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .build();
  }
}
