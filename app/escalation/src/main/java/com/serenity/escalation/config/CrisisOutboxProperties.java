/*
 * Where: escalation configuration binding
 * What: outbox publish polling and retry settings
 * Why: publish pacing is tuned per environment
 */
package com.serenity.escalation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crisis.outbox")
public record CrisisOutboxProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    int errorMessageMaxLength,
    Duration lease,
    Duration publishedTtl) {}
