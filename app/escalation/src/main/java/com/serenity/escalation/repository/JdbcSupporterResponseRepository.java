package com.serenity.escalation.repository;

import static com.serenity.common.JdbcTimestampUtils.toInstant;
import static com.serenity.common.JdbcTimestampUtils.toTimestamp;

import com.serenity.escalation.model.CoordinationStatus;
import com.serenity.escalation.model.ResponseSummary;
import com.serenity.escalation.model.ResponseType;
import com.serenity.escalation.model.SupporterResponseRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSupporterResponseRepository implements SupporterResponseRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT response_id, crisis_alert_id, responder_id, response_type, notes, responded_at,
             coordination_status, first_responder
      FROM supporter_responses
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(SupporterResponseRecord record) {
    // uq_supporter_responses_active rejects a second ACTIVE row for the same responder
    final String sql =
        """
        INSERT INTO supporter_responses (
          response_id,
          crisis_alert_id,
          responder_id,
          response_type,
          notes,
          responded_at,
          coordination_status,
          first_responder
        ) VALUES (
          :responseId,
          :crisisAlertId,
          :responderId,
          :responseType,
          :notes,
          :respondedAt,
          :coordinationStatus,
          :firstResponder
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("responseId", record.responseId())
            .addValue("crisisAlertId", record.crisisAlertId())
            .addValue("responderId", record.responderId())
            .addValue("responseType", record.responseType().name())
            .addValue("notes", record.notes())
            .addValue("respondedAt", toTimestamp(record.respondedAt()))
            .addValue("coordinationStatus", record.coordinationStatus().name())
            .addValue("firstResponder", record.firstResponder());
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<SupporterResponseRecord> findActive(UUID crisisAlertId, String responderId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE crisis_alert_id = :crisisAlertId
              AND responder_id = :responderId
              AND coordination_status = 'ACTIVE'
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("crisisAlertId", crisisAlertId)
            .addValue("responderId", responderId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public int supersede(UUID responseId) {
    final String sql =
        """
        UPDATE supporter_responses
        SET coordination_status = 'SUPERSEDED'
        WHERE response_id = :responseId
          AND coordination_status = 'ACTIVE'
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("responseId", responseId));
  }

  @Override
  public List<SupporterResponseRecord> findByCrisisAlertId(UUID crisisAlertId) {
    final String sql = SELECT_COLUMNS + "WHERE crisis_alert_id = :crisisAlertId ORDER BY responded_at";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("crisisAlertId", crisisAlertId), this::mapRow);
  }

  @Override
  public boolean existsActiveEngaging(UUID crisisAlertId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM supporter_responses
          WHERE crisis_alert_id = :crisisAlertId
            AND coordination_status = 'ACTIVE'
            AND response_type IN (:engagingTypes)
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("crisisAlertId", crisisAlertId)
            .addValue("engagingTypes", engagingTypeNames());
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  @Override
  public boolean hasEngaged(UUID crisisAlertId, String responderId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM supporter_responses
          WHERE crisis_alert_id = :crisisAlertId
            AND responder_id = :responderId
            AND response_type IN (:engagingTypes)
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("crisisAlertId", crisisAlertId)
            .addValue("responderId", responderId)
            .addValue("engagingTypes", engagingTypeNames());
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  @Override
  public ResponseSummary summarize(UUID crisisAlertId) {
    final String sql =
        """
        SELECT response_type,
               COUNT(*) AS response_count,
               MIN(responded_at) AS first_at,
               MAX(responded_at) AS last_at
        FROM supporter_responses
        WHERE crisis_alert_id = :crisisAlertId
        GROUP BY response_type
        """;
    final Map<ResponseType, Long> counts = new EnumMap<>(ResponseType.class);
    final Instant[] bounds = new Instant[2];
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("crisisAlertId", crisisAlertId),
        (RowCallbackHandler)
            rs -> {
              counts.put(
                  ResponseType.valueOf(rs.getString("response_type")),
                  rs.getLong("response_count"));
              final Instant first = toInstant(rs.getTimestamp("first_at"));
              final Instant last = toInstant(rs.getTimestamp("last_at"));
              if (bounds[0] == null || first.isBefore(bounds[0])) {
                bounds[0] = first;
              }
              if (bounds[1] == null || last.isAfter(bounds[1])) {
                bounds[1] = last;
              }
            });
    final long total = counts.values().stream().mapToLong(Long::longValue).sum();
    return new ResponseSummary(crisisAlertId, counts, total, bounds[0], bounds[1]);
  }

  @Override
  public Double averageFirstResponseSeconds(Instant since) {
    final String sql =
        """
        SELECT AVG(EXTRACT(EPOCH FROM (r.first_at - a.created_at))) AS avg_seconds
        FROM crisis_alerts a
        JOIN (
          SELECT crisis_alert_id, MIN(responded_at) AS first_at
          FROM supporter_responses
          GROUP BY crisis_alert_id
        ) r ON r.crisis_alert_id = a.crisis_alert_id
        WHERE a.created_at >= :since
        """;
    return jdbcTemplate.queryForObject(
        sql, new MapSqlParameterSource().addValue("since", toTimestamp(since)), Double.class);
  }

  private List<String> engagingTypeNames() {
    return Arrays.stream(ResponseType.values())
        .filter(ResponseType::engaging)
        .map(Enum::name)
        .toList();
  }

  private SupporterResponseRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SupporterResponseRecord(
        UUID.fromString(rs.getString("response_id")),
        UUID.fromString(rs.getString("crisis_alert_id")),
        rs.getString("responder_id"),
        ResponseType.valueOf(rs.getString("response_type")),
        rs.getString("notes"),
        toInstant(rs.getTimestamp("responded_at")),
        CoordinationStatus.valueOf(rs.getString("coordination_status")),
        rs.getBoolean("first_responder"));
  }
}
