package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;

public record SupporterResponseRecord(
    UUID responseId,
    UUID crisisAlertId,
    String responderId,
    ResponseType responseType,
    String notes,
    Instant respondedAt,
    CoordinationStatus coordinationStatus,
    boolean firstResponder) {}
