package com.serenity.escalation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SystemHealthResponse(
    String status,
    long queuedCount,
    long failedCount,
    long activeCrises,
    Double averageResponseSeconds,
    String checkedAt) {}
