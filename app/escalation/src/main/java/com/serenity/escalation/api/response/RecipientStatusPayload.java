package com.serenity.escalation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One recipient's delivery progress; {@code deliveryState} is null until the first send. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecipientStatusPayload(
    String recipientId,
    String responderId,
    int tier,
    String channel,
    String deliveryState,
    String queueStatus,
    int retryCount,
    String sentAt,
    String deliveredAt,
    String acknowledgedAt,
    String failedAt,
    String lastReason) {}
