package com.serenity.escalation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code accepted} is false when the callback did not advance the recipient's status. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryCallbackResponse(String recipientId, boolean accepted) {}
