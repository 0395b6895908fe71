package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;

public record RecipientRecord(
    UUID recipientId,
    UUID requestId,
    String responderId,
    ResponderRole responderRole,
    int tier,
    Channel channel,
    int priorityOrder,
    Instant scheduledFor,
    Instant createdAt) {}
