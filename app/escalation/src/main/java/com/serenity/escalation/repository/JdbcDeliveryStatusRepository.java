/*
 * Where: escalation data access
 * What: delivery_events log and the realtime_delivery_status view
 * Why: the view only advances by status_rank so late or replayed receipts cannot regress it
 */
package com.serenity.escalation.repository;

import static com.serenity.common.JdbcTimestampUtils.toInstant;
import static com.serenity.common.JdbcTimestampUtils.toTimestamp;

import com.serenity.escalation.model.DeliveryEventRecord;
import com.serenity.escalation.model.DeliveryState;
import com.serenity.escalation.model.DeliveryStatusRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcDeliveryStatusRepository implements DeliveryStatusRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT recipient_id, request_id, tier, connection_id, state, delivery_id, sent_at,
             delivered_at, acked_at, failed_at, last_reason, updated_at
      FROM realtime_delivery_status
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void appendEvent(DeliveryEventRecord event) {
    final String sql =
        """
        INSERT INTO delivery_events (event_id, recipient_id, request_id, state, detail, occurred_at)
        VALUES (:eventId, :recipientId, :requestId, :state, :detail, :occurredAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", event.eventId())
            .addValue("recipientId", event.recipientId())
            .addValue("requestId", event.requestId())
            .addValue("state", event.state().name())
            .addValue("detail", event.detail())
            .addValue("occurredAt", toTimestamp(event.occurredAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public int advance(DeliveryStatusRecord status) {
    final String sql =
        """
        INSERT INTO realtime_delivery_status AS s (
          recipient_id,
          request_id,
          tier,
          connection_id,
          state,
          status_rank,
          delivery_id,
          sent_at,
          delivered_at,
          acked_at,
          failed_at,
          last_reason,
          updated_at
        ) VALUES (
          :recipientId,
          :requestId,
          :tier,
          :connectionId,
          :state,
          :statusRank,
          :deliveryId,
          :sentAt,
          :deliveredAt,
          :ackedAt,
          :failedAt,
          :lastReason,
          :updatedAt
        )
        ON CONFLICT (recipient_id) DO UPDATE
        SET state = EXCLUDED.state,
            status_rank = EXCLUDED.status_rank,
            connection_id = COALESCE(EXCLUDED.connection_id, s.connection_id),
            delivery_id = COALESCE(EXCLUDED.delivery_id, s.delivery_id),
            sent_at = COALESCE(s.sent_at, EXCLUDED.sent_at),
            delivered_at = COALESCE(s.delivered_at, EXCLUDED.delivered_at),
            acked_at = COALESCE(s.acked_at, EXCLUDED.acked_at),
            failed_at = COALESCE(s.failed_at, EXCLUDED.failed_at),
            last_reason = COALESCE(EXCLUDED.last_reason, s.last_reason),
            updated_at = EXCLUDED.updated_at
        WHERE s.status_rank < EXCLUDED.status_rank
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", status.recipientId())
            .addValue("requestId", status.requestId())
            .addValue("tier", status.tier())
            .addValue("connectionId", status.connectionId())
            .addValue("state", status.state().name())
            .addValue("statusRank", status.state().rank())
            .addValue("deliveryId", status.deliveryId())
            .addValue("sentAt", toTimestamp(status.sentAt()))
            .addValue("deliveredAt", toTimestamp(status.deliveredAt()))
            .addValue("ackedAt", toTimestamp(status.ackedAt()))
            .addValue("failedAt", toTimestamp(status.failedAt()))
            .addValue("lastReason", status.lastReason())
            .addValue("updatedAt", toTimestamp(status.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<DeliveryStatusRecord> findByRecipientId(UUID recipientId) {
    final String sql = SELECT_COLUMNS + "WHERE recipient_id = :recipientId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("recipientId", recipientId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public List<DeliveryStatusRecord> findByRequestId(UUID requestId) {
    final String sql = SELECT_COLUMNS + "WHERE request_id = :requestId ORDER BY tier, updated_at";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("requestId", requestId), this::mapRow);
  }

  @Override
  public int deleteOlderThan(Instant threshold) {
    final String sql = "DELETE FROM realtime_delivery_status WHERE updated_at < :threshold";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  private DeliveryStatusRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return DeliveryStatusRecord.builder()
        .recipientId(UUID.fromString(rs.getString("recipient_id")))
        .requestId(UUID.fromString(rs.getString("request_id")))
        .tier(rs.getInt("tier"))
        .connectionId(rs.getString("connection_id"))
        .state(DeliveryState.valueOf(rs.getString("state")))
        .deliveryId(rs.getString("delivery_id"))
        .sentAt(toInstant(rs.getTimestamp("sent_at")))
        .deliveredAt(toInstant(rs.getTimestamp("delivered_at")))
        .ackedAt(toInstant(rs.getTimestamp("acked_at")))
        .failedAt(toInstant(rs.getTimestamp("failed_at")))
        .lastReason(rs.getString("last_reason"))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .build();
  }
}
