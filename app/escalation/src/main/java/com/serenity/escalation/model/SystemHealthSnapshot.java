package com.serenity.escalation.model;

import java.time.Instant;

public record SystemHealthSnapshot(
    HealthStatus status,
    long queuedCount,
    long failedCount,
    long activeCrises,
    Double averageResponseSeconds,
    Instant checkedAt) {}
