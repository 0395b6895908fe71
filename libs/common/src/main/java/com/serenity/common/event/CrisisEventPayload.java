/*
 * Where: shared event payload definitions
 * What: JSON shape of a crisis lifecycle event stored in the outbox
 * Why: the writer (state machine) and the publisher agree on one record
 */
package com.serenity.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CrisisEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String crisisAlertId,
    String requestId,
    String subjectUserId,
    String severity,
    int tier,
    Map<String, String> attributes,
    String traceId) {

  public CrisisEventPayload {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
