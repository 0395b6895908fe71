package com.serenity.escalation.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ResponseSummary(
    UUID crisisAlertId,
    Map<ResponseType, Long> countsByType,
    long totalResponses,
    Instant firstResponseAt,
    Instant lastResponseAt) {

  public ResponseSummary {
    countsByType = countsByType == null ? Map.of() : Map.copyOf(countsByType);
  }
}
