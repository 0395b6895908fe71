/*
 * Where: escalation data access
 * What: notification_queue claim/result writes and notification_queue_audit
 * Why: several processor instances share the queue through SKIP LOCKED claims and leases
 */
package com.serenity.escalation.repository;

import static com.serenity.common.JdbcTimestampUtils.toInstant;
import static com.serenity.common.JdbcTimestampUtils.toTimestamp;

import com.serenity.escalation.model.ClaimedQueueItem;
import com.serenity.escalation.model.QueueAuditRecord;
import com.serenity.escalation.model.QueueItemRecord;
import com.serenity.escalation.model.QueueItemStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationQueueRepository implements NotificationQueueRepository {

  private static final String RETURNING_COLUMNS =
      """
      queue_item_id, seq, request_id, crisis_alert_id, recipient_id, status, priority,
      scheduled_for, retry_count, max_retries, locked_by, locked_at, lease_until,
      delivery_id, last_error, processed_at, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public QueueItemRecord insert(QueueItemRecord record) {
    final String sql =
        """
        INSERT INTO notification_queue (
          queue_item_id,
          request_id,
          crisis_alert_id,
          recipient_id,
          status,
          priority,
          scheduled_for,
          retry_count,
          max_retries,
          created_at
        ) VALUES (
          :queueItemId,
          :requestId,
          :crisisAlertId,
          :recipientId,
          :status,
          :priority,
          :scheduledFor,
          :retryCount,
          :maxRetries,
          :createdAt
        )
        RETURNING
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueItemId", record.queueItemId())
            .addValue("requestId", record.requestId())
            .addValue("crisisAlertId", record.crisisAlertId())
            .addValue("recipientId", record.recipientId())
            .addValue("status", record.status().name())
            .addValue("priority", record.priority())
            .addValue("scheduledFor", toTimestamp(record.scheduledFor()))
            .addValue("retryCount", record.retryCount())
            .addValue("maxRetries", record.maxRetries())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  @Override
  public Optional<QueueItemRecord> findById(UUID queueItemId) {
    final String sql =
        "SELECT " + RETURNING_COLUMNS + " FROM notification_queue WHERE queue_item_id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", queueItemId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public List<QueueItemRecord> findByCrisisAlertId(UUID crisisAlertId) {
    final String sql =
        "SELECT "
            + RETURNING_COLUMNS
            + " FROM notification_queue WHERE crisis_alert_id = :crisisAlertId ORDER BY seq";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("crisisAlertId", crisisAlertId), this::mapRow);
  }

  @Override
  public List<ClaimedQueueItem> claimDue(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // due QUEUED items and PROCESSING items with an expired lease, in one statement
    final String sql =
        """
        WITH cte AS (
          SELECT queue_item_id, status AS previous_status, locked_by AS previous_owner
          FROM notification_queue
          WHERE (
            status = 'QUEUED'
            AND scheduled_for <= :now
          )
          OR (
            status = 'PROCESSING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY priority DESC, scheduled_for, seq
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_queue q
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE q.queue_item_id = cte.queue_item_id
        RETURNING q.queue_item_id, q.seq, q.request_id, q.crisis_alert_id, q.recipient_id,
                  q.status, q.priority, q.scheduled_for, q.retry_count, q.max_retries,
                  q.locked_by, q.locked_at, q.lease_until, q.delivery_id, q.last_error,
                  q.processed_at, q.created_at, cte.previous_status, cte.previous_owner
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    final List<ClaimedQueueItem> claimed =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new ClaimedQueueItem(
                    mapRow(rs, rowNum),
                    QueueItemStatus.valueOf(rs.getString("previous_status")),
                    rs.getString("previous_owner")));
    // RETURNING does not keep the CTE order
    return claimed.stream()
        .sorted(
            Comparator.comparing(
                ClaimedQueueItem::item,
                Comparator.comparingInt(QueueItemRecord::priority)
                    .reversed()
                    .thenComparing(QueueItemRecord::scheduledFor)
                    .thenComparingLong(QueueItemRecord::seq)))
        .toList();
  }

  @Override
  public int markSent(UUID queueItemId, String lockedBy, String deliveryId, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'SENT',
            delivery_id = :deliveryId,
            processed_at = :now,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE queue_item_id = :queueItemId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", deliveryId)
            .addValue("now", toTimestamp(now))
            .addValue("queueItemId", queueItemId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markRetry(
      UUID queueItemId, String lockedBy, int retryCount, Instant scheduledFor, String lastError) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'QUEUED',
            retry_count = :retryCount,
            scheduled_for = :scheduledFor,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE queue_item_id = :queueItemId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("retryCount", retryCount)
            .addValue("scheduledFor", toTimestamp(scheduledFor))
            .addValue("lastError", lastError)
            .addValue("queueItemId", queueItemId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markFailed(
      UUID queueItemId, String lockedBy, int retryCount, String lastError, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'FAILED',
            retry_count = :retryCount,
            last_error = :lastError,
            processed_at = :now,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE queue_item_id = :queueItemId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("retryCount", retryCount)
            .addValue("lastError", lastError)
            .addValue("now", toTimestamp(now))
            .addValue("queueItemId", queueItemId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markCancelled(UUID queueItemId, String lockedBy, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'CANCELLED',
            processed_at = :now,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE queue_item_id = :queueItemId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("queueItemId", queueItemId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markDelivered(UUID recipientId, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'DELIVERED',
            processed_at = :now
        WHERE recipient_id = :recipientId
          AND status = 'SENT'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("recipientId", recipientId);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public List<UUID> cancelQueued(UUID crisisAlertId, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'CANCELLED',
            processed_at = :now
        WHERE crisis_alert_id = :crisisAlertId
          AND status = 'QUEUED'
        RETURNING queue_item_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("crisisAlertId", crisisAlertId);
    return jdbcTemplate.query(
        sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("queue_item_id")));
  }

  @Override
  public long countByStatus(QueueItemStatus status) {
    final String sql = "SELECT COUNT(*) FROM notification_queue WHERE status = :status";
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("status", status.name()), Long.class);
    return count == null ? 0L : count;
  }

  @Override
  public void insertAudit(QueueAuditRecord record) {
    final String sql =
        """
        INSERT INTO notification_queue_audit (
          queue_item_id, from_status, to_status, detail, occurred_at
        ) VALUES (
          :queueItemId, :fromStatus, :toStatus, :detail, :occurredAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueItemId", record.queueItemId())
            .addValue("fromStatus", record.fromStatus() == null ? null : record.fromStatus().name())
            .addValue("toStatus", record.toStatus().name())
            .addValue("detail", record.detail())
            .addValue("occurredAt", toTimestamp(record.occurredAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<QueueAuditRecord> findAudit(UUID queueItemId) {
    final String sql =
        """
        SELECT queue_item_id, from_status, to_status, detail, occurred_at
        FROM notification_queue_audit
        WHERE queue_item_id = :queueItemId
        ORDER BY audit_id
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("queueItemId", queueItemId),
        (rs, rowNum) -> {
          final String from = rs.getString("from_status");
          return new QueueAuditRecord(
              UUID.fromString(rs.getString("queue_item_id")),
              from == null ? null : QueueItemStatus.valueOf(from),
              QueueItemStatus.valueOf(rs.getString("to_status")),
              rs.getString("detail"),
              toInstant(rs.getTimestamp("occurred_at")));
        });
  }

  @Override
  public int deleteProcessedOlderThan(Instant threshold) {
    // QUEUED, PROCESSING and FAILED rows stay for operators
    final String sql =
        """
        DELETE FROM notification_queue
        WHERE created_at < :threshold
          AND status IN ('SENT', 'DELIVERED', 'CANCELLED')
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  private QueueItemRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return QueueItemRecord.builder()
        .queueItemId(UUID.fromString(rs.getString("queue_item_id")))
        .seq(rs.getLong("seq"))
        .requestId(UUID.fromString(rs.getString("request_id")))
        .crisisAlertId(UUID.fromString(rs.getString("crisis_alert_id")))
        .recipientId(UUID.fromString(rs.getString("recipient_id")))
        .status(QueueItemStatus.valueOf(rs.getString("status")))
        .priority(rs.getInt("priority"))
        .scheduledFor(toInstant(rs.getTimestamp("scheduled_for")))
        .retryCount(rs.getInt("retry_count"))
        .maxRetries(rs.getInt("max_retries"))
        .lockedBy(rs.getString("locked_by"))
        .lockedAt(toInstant(rs.getTimestamp("locked_at")))
        .leaseUntil(toInstant(rs.getTimestamp("lease_until")))
        .deliveryId(rs.getString("delivery_id"))
        .lastError(rs.getString("last_error"))
        .processedAt(toInstant(rs.getTimestamp("processed_at")))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .build();
  }
}
