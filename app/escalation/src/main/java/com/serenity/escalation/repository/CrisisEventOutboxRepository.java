/*
 * Where: escalation data access
 * What: crisis_event_outbox insert/claim/status writes
 * Why: lifecycle events are committed with the state change and published afterwards
 */
package com.serenity.escalation.repository;

import static com.serenity.common.JdbcTimestampUtils.toTimestamp;

import com.serenity.escalation.model.CrisisOutboxEventRecord;
import com.serenity.escalation.model.OutboxStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CrisisEventOutboxRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public CrisisEventOutboxRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // EI_EXPOSE_REP2: keep our own wrapper instead of the shared reference
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(
      UUID eventId, String eventType, String aggregateKey, String payloadJson, Instant createdAt) {
    final String sql =
        """
        INSERT INTO crisis_event_outbox (
          event_id,
          event_type,
          aggregate_key,
          payload,
          status,
          attempt_count,
          next_retry_at,
          created_at
        ) VALUES (
          :eventId,
          :eventType,
          :aggregateKey,
          CAST(:payload AS jsonb),
          'PENDING',
          0,
          NULL,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("aggregateKey", aggregateKey)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public List<CrisisOutboxEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT event_id
          FROM crisis_event_outbox
          WHERE (
            status = 'PENDING'
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          )
          OR (
            status = 'IN_FLIGHT'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE crisis_event_outbox e
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            last_error = NULL
        FROM cte
        WHERE e.event_id = cte.event_id
        RETURNING e.event_id, e.event_type, e.aggregate_key, e.payload::text AS payload_text,
                  e.attempt_count, e.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE crisis_event_outbox
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("publishedAt", toTimestamp(publishedAt))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailure(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE crisis_event_outbox
        SET attempt_count = :attemptCount,
            status = :status,
            next_retry_at = :nextRetryAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            last_error = :lastError
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("status", status.name())
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int deletePublishedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM crisis_event_outbox
        WHERE status = 'PUBLISHED'
          AND published_at <= :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  public int countFailed() {
    final String sql = "SELECT COUNT(*) FROM crisis_event_outbox WHERE status = 'FAILED'";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private CrisisOutboxEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CrisisOutboxEventRecord(
        UUID.fromString(rs.getString("event_id")),
        rs.getString("event_type"),
        rs.getString("aggregate_key"),
        rs.getString("payload_text"),
        rs.getInt("attempt_count"));
  }
}
