/*
 * Where: escalation outbox publisher
 * What: claims crisis_event_outbox rows and publishes them to JetStream as CrisisAlertEvent
 * Why: the alert change and its event commit together; publishing happens after with retries
 */
package com.serenity.escalation.service;

import static com.google.common.base.Strings.nullToEmpty;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.serenity.common.event.CrisisEventPayload;
import com.serenity.escalation.config.CrisisEventNatsProperties;
import com.serenity.escalation.config.CrisisOutboxProperties;
import com.serenity.escalation.model.CrisisEventType;
import com.serenity.escalation.model.CrisisOutboxEventRecord;
import com.serenity.escalation.model.OutboxStatus;
import com.serenity.escalation.repository.CrisisEventOutboxRepository;
import com.serenity.proto.crisis.CrisisAlertEvent;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(
    name = {"crisis.outbox.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class CrisisEventOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(CrisisEventOutboxPublisher.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_CRISIS_ALERT_ID = "crisis_alert_id";
  private static final String HEADER_OCCURRED_AT = "occurred_at";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final CrisisEventOutboxRepository outboxRepository;
  private final CrisisOutboxProperties properties;
  private final CrisisEventNatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final EscalationMetrics metrics;
  private final Clock clock;

  public void publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = WorkerIdentity.resolve();
    final List<CrisisOutboxEventRecord> pending =
        outboxRepository.claimPending(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    for (CrisisOutboxEventRecord record : pending) {
      try {
        final CrisisEventPayload payload = parsePayload(record);
        final PublishAck ack =
            jetStream.publish(
                natsProperties.subject(),
                buildHeaders(record, payload),
                buildEvent(record, payload).toByteArray());
        if (ack == null) {
          throw new IllegalStateException("puback is missing");
        }
        if (outboxRepository.markPublished(record.eventId(), lockedBy, now) == 0) {
          logger.warn("crisis event published but lock was lost eventId={}", record.eventId());
        } else {
          metrics.recordOutboxPublishDelay(Instant.parse(payload.occurredAt()), now);
        }
      } catch (JetStreamApiException | IOException | RuntimeException ex) {
        handleFailure(record, ex, now, lockedBy);
      }
    }
    metrics.updateOutboxFailed(outboxRepository.countFailed());
  }

  @VisibleForTesting
  CrisisAlertEvent buildEvent(CrisisOutboxEventRecord record, CrisisEventPayload payload) {
    return CrisisAlertEvent.newBuilder()
        .setEventId(payload.eventId())
        .setEventType(mapEventType(record.eventType()))
        .setOccurredAt(payload.occurredAt())
        .setCrisisAlertId(payload.crisisAlertId())
        .setRequestId(nullToEmpty(payload.requestId()))
        .setSubjectUserId(nullToEmpty(payload.subjectUserId()))
        .setSeverity(nullToEmpty(payload.severity()))
        .setTier(payload.tier())
        .putAllAttributes(payload.attributes())
        .setTraceId(nullToEmpty(payload.traceId()))
        .build();
  }

  private CrisisEventPayload parsePayload(CrisisOutboxEventRecord record) {
    try {
      return objectMapper.readValue(record.payloadJson(), CrisisEventPayload.class);
    } catch (JsonProcessingException ex) {
      throw new OutboxPayloadParseException("outbox payload parse failure", ex);
    }
  }

  private Headers buildHeaders(CrisisOutboxEventRecord record, CrisisEventPayload payload) {
    final Headers headers = new Headers();
    // JetStream drops a second publish with the same id inside the duplicate window
    headers.add(HEADER_MESSAGE_ID, payload.eventId());
    headers.add(HEADER_EVENT_TYPE, record.eventType());
    headers.add(HEADER_CRISIS_ALERT_ID, record.aggregateKey());
    headers.add(HEADER_OCCURRED_AT, payload.occurredAt());
    if (payload.traceId() != null) {
      headers.add(HEADER_TRACE_ID, payload.traceId());
    }
    return headers;
  }

  private void handleFailure(
      CrisisOutboxEventRecord record, Exception ex, Instant now, String lockedBy) {
    final boolean nonRetryable =
        ex instanceof OutboxPayloadParseException || ex instanceof IllegalArgumentException;
    final int nextAttempt = nonRetryable ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean failed = nonRetryable || nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoff(nextAttempt));
    final int updated =
        outboxRepository.markFailure(
            record.eventId(),
            lockedBy,
            nextAttempt,
            failed ? OutboxStatus.FAILED : OutboxStatus.PENDING,
            nextRetryAt,
            truncateError(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "crisis event retry skipped because lock was lost eventId={} attempt={}",
          record.eventId(),
          nextAttempt);
    }
    if (failed) {
      logger.error(
          "crisis event moved to FAILED eventId={} type={}", record.eventId(), record.eventType(), ex);
    } else {
      logger.warn(
          "crisis event publish retry scheduled eventId={} attempt={}",
          record.eventId(),
          nextAttempt,
          ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoff(int attempt) {
    final long baseMillis = Math.max(properties.backoffBase().toMillis(), 1);
    final long maxMillis = properties.backoffMax().toMillis();
    final int exponent = Math.max(0, attempt - 1);
    if (exponent >= 62 || (1L << exponent) > maxMillis / baseMillis) {
      return properties.backoffMax();
    }
    return Duration.ofMillis(Math.min(baseMillis << exponent, maxMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private static CrisisAlertEvent.EventType mapEventType(String wireName) {
    // the protobuf enum mirrors CrisisEventType constant for constant
    return CrisisAlertEvent.EventType.valueOf(CrisisEventType.fromWireName(wireName).name());
  }

  private static final class OutboxPayloadParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
