package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;

public record DeliveryEventRecord(
    UUID eventId,
    UUID recipientId,
    UUID requestId,
    DeliveryState state,
    String detail,
    Instant occurredAt) {}
