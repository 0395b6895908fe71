package com.serenity.escalation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EscalationLogPayload(
    int previousTier, int newTier, String reason, String escalatedAt) {}
