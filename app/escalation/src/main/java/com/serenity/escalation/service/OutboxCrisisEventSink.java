/*
 * Where: escalation service layer
 * What: event sink that stores lifecycle events in crisis_event_outbox
 * Why: the event commits or rolls back together with the alert change that produced it
 */
package com.serenity.escalation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serenity.common.event.CrisisEventPayload;
import com.serenity.escalation.model.CrisisLifecycleEvent;
import com.serenity.escalation.repository.CrisisEventOutboxRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crisis.outbox.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxCrisisEventSink implements CrisisEventSink {

  private final CrisisEventOutboxRepository outboxRepository;
  private final ObjectMapper objectMapper;

  @Override
  public void emit(CrisisLifecycleEvent event) {
    final CrisisEventPayload payload =
        new CrisisEventPayload(
            event.eventId().toString(),
            event.type().wireName(),
            event.timestamp().toString(),
            event.crisisAlertId().toString(),
            event.requestId() == null ? null : event.requestId().toString(),
            event.subjectUserId(),
            event.severity() == null ? null : event.severity().name(),
            event.tier(),
            event.attributes(),
            MDC.get("trace_id"));
    final String payloadJson;
    try {
      payloadJson = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize crisis event " + event.eventId(), ex);
    }
    outboxRepository.insert(
        event.eventId(),
        event.type().wireName(),
        event.crisisAlertId().toString(),
        payloadJson,
        event.timestamp());
  }
}
