package com.serenity.escalation.repository;

import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.NotificationKind;
import com.serenity.escalation.model.NotificationRequestRecord;
import com.serenity.escalation.model.RecipientRecord;
import com.serenity.escalation.model.ResponderRole;
import com.serenity.escalation.model.Severity;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Seeds request, alert and recipient rows that queue and response rows reference. */
final class AlertRows {

  private final NotificationRequestRepository requests;
  private final CrisisAlertRepository alerts;
  private final RecipientRepository recipients;

  AlertRows(
      NotificationRequestRepository requests,
      CrisisAlertRepository alerts,
      RecipientRepository recipients) {
    this.requests = requests;
    this.alerts = alerts;
    this.recipients = recipients;
  }

  static void truncateAll(NamedParameterJdbcTemplate jdbcTemplate) {
    jdbcTemplate.update(
        """
        TRUNCATE notification_queue_audit, notification_queue, delivery_events,
                 realtime_delivery_status, supporter_responses, crisis_escalation_logs,
                 notification_recipients, crisis_alerts, notification_requests,
                 support_network_members, crisis_event_outbox
        """,
        new MapSqlParameterSource());
  }

  CrisisAlertRecord openAlert(Severity severity, Instant now) {
    final UUID requestId = UUID.randomUUID();
    requests.insert(
        new NotificationRequestRecord(
            requestId, "user-1", "Sam", NotificationKind.CRISIS, null, null, null, now, null));
    final CrisisAlertRecord alert =
        CrisisAlertRecord.builder()
            .crisisAlertId(UUID.randomUUID())
            .requestId(requestId)
            .severity(severity)
            .status(CrisisAlertStatus.SENT)
            .tier(1)
            .escalationDeadline(now.plusSeconds(30))
            .expiresAt(now.plus(Duration.ofHours(24)))
            .createdAt(now)
            .updatedAt(now)
            .build();
    alerts.insert(alert);
    return alert;
  }

  RecipientRecord recipient(CrisisAlertRecord alert, String responderId, int tier, Instant now) {
    final RecipientRecord recipient =
        new RecipientRecord(
            UUID.randomUUID(),
            alert.requestId(),
            responderId,
            ResponderRole.SUPPORTER,
            tier,
            Channel.PUSH,
            0,
            now,
            now);
    recipients.insertIfAbsent(recipient);
    return recipient;
  }
}
