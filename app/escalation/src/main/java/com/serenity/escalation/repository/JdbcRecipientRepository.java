package com.serenity.escalation.repository;

import static com.serenity.common.JdbcTimestampUtils.toInstant;
import static com.serenity.common.JdbcTimestampUtils.toTimestamp;

import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.RecipientRecord;
import com.serenity.escalation.model.ResponderRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcRecipientRepository implements RecipientRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT recipient_id, request_id, responder_id, responder_role, tier, channel,
             priority_order, scheduled_for, created_at
      FROM notification_recipients
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public boolean insertIfAbsent(RecipientRecord record) {
    // uq_notification_recipients_request_responder keeps one row per responder per request
    final String sql =
        """
        INSERT INTO notification_recipients (
          recipient_id,
          request_id,
          responder_id,
          responder_role,
          tier,
          channel,
          priority_order,
          scheduled_for,
          created_at
        ) VALUES (
          :recipientId,
          :requestId,
          :responderId,
          :responderRole,
          :tier,
          :channel,
          :priorityOrder,
          :scheduledFor,
          :createdAt
        )
        ON CONFLICT (request_id, responder_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", record.recipientId())
            .addValue("requestId", record.requestId())
            .addValue("responderId", record.responderId())
            .addValue("responderRole", record.responderRole().name())
            .addValue("tier", record.tier())
            .addValue("channel", record.channel().name())
            .addValue("priorityOrder", record.priorityOrder())
            .addValue("scheduledFor", toTimestamp(record.scheduledFor()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params) == 1;
  }

  @Override
  public Optional<RecipientRecord> findById(UUID recipientId) {
    final String sql = SELECT_COLUMNS + "WHERE recipient_id = :recipientId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("recipientId", recipientId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<RecipientRecord> findByRequestAndResponder(UUID requestId, String responderId) {
    final String sql =
        SELECT_COLUMNS + "WHERE request_id = :requestId AND responder_id = :responderId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("responderId", responderId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<RecipientRecord> findByRequestId(UUID requestId) {
    final String sql = SELECT_COLUMNS + "WHERE request_id = :requestId ORDER BY tier, priority_order";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("requestId", requestId), this::mapRow);
  }

  @Override
  public List<RecipientRecord> findByRequestAndTier(UUID requestId, int tier) {
    final String sql =
        SELECT_COLUMNS + "WHERE request_id = :requestId AND tier = :tier ORDER BY priority_order";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId).addValue("tier", tier);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private RecipientRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RecipientRecord(
        UUID.fromString(rs.getString("recipient_id")),
        UUID.fromString(rs.getString("request_id")),
        rs.getString("responder_id"),
        ResponderRole.valueOf(rs.getString("responder_role")),
        rs.getInt("tier"),
        Channel.valueOf(rs.getString("channel")),
        rs.getInt("priority_order"),
        toInstant(rs.getTimestamp("scheduled_for")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
