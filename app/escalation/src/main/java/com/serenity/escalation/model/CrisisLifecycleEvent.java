/*
 * Where: escalation model
 * What: lifecycle event handed to the event sink
 * Why: keeps the state machine independent of how events are stored or published
 */
package com.serenity.escalation.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record CrisisLifecycleEvent(
    UUID eventId,
    CrisisEventType type,
    UUID crisisAlertId,
    UUID requestId,
    String subjectUserId,
    Severity severity,
    int tier,
    Instant timestamp,
    Map<String, String> attributes) {

  public CrisisLifecycleEvent {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
