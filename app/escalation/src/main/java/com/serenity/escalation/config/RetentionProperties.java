/*
 * Where: escalation configuration binding
 * What: retention periods for processed queue items, delivery status and escalation logs
 * Why: each table ages out on its own schedule
 */
package com.serenity.escalation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crisis.retention")
public record RetentionProperties(
    boolean enabled,
    Duration cleanupInterval,
    int queueRetentionDays,
    int deliveryStatusRetentionDays,
    int escalationLogRetentionDays) {}
