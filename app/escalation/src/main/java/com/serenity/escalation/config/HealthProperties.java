package com.serenity.escalation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Thresholds for the system health summary. */
@ConfigurationProperties(prefix = "crisis.health")
public record HealthProperties(
    long failedDegradedThreshold, long queuedWarningThreshold, Duration responseTimeWindow) {}
