package com.serenity.escalation.repository;

import static com.serenity.common.JdbcTimestampUtils.toInstant;
import static com.serenity.common.JdbcTimestampUtils.toTimestamp;

import com.serenity.escalation.model.NotificationKind;
import com.serenity.escalation.model.NotificationRequestRecord;
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
public class JdbcNotificationRequestRepository implements NotificationRequestRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(NotificationRequestRecord record) {
    final String sql =
        """
        INSERT INTO notification_requests (
          request_id,
          subject_user_id,
          subject_display_name,
          kind,
          message,
          custom_message,
          location,
          created_at,
          closed_at
        ) VALUES (
          :requestId,
          :subjectUserId,
          :subjectDisplayName,
          :kind,
          :message,
          :customMessage,
          CAST(:location AS jsonb),
          :createdAt,
          :closedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", record.requestId())
            .addValue("subjectUserId", record.subjectUserId())
            .addValue("subjectDisplayName", record.subjectDisplayName())
            .addValue("kind", record.kind().name())
            .addValue("message", record.message())
            .addValue("customMessage", record.customMessage())
            .addValue("location", record.locationJson())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("closedAt", toTimestamp(record.closedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<NotificationRequestRecord> findById(UUID requestId) {
    final String sql =
        """
        SELECT request_id, subject_user_id, subject_display_name, kind, message, custom_message,
               location::text AS location_text, created_at, closed_at
        FROM notification_requests
        WHERE request_id = :requestId
        """;
    final List<NotificationRequestRecord> rows =
        jdbcTemplate.query(
            sql, new MapSqlParameterSource().addValue("requestId", requestId), this::mapRow);
    return rows.stream().findFirst();
  }

  @Override
  public int markClosed(UUID requestId, Instant closedAt) {
    final String sql =
        """
        UPDATE notification_requests
        SET closed_at = :closedAt
        WHERE request_id = :requestId
          AND closed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("closedAt", toTimestamp(closedAt))
            .addValue("requestId", requestId);
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRequestRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRequestRecord(
        UUID.fromString(rs.getString("request_id")),
        rs.getString("subject_user_id"),
        rs.getString("subject_display_name"),
        NotificationKind.valueOf(rs.getString("kind")),
        rs.getString("message"),
        rs.getString("custom_message"),
        rs.getString("location_text"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("closed_at")));
  }
}
