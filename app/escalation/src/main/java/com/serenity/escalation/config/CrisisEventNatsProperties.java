/*
 * Where: escalation configuration binding
 * What: subject and JetStream stream used to publish lifecycle events
 * Why: the duplicate window backs Nats-Msg-Id deduplication
 */
package com.serenity.escalation.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "crisis.nats.events")
public record CrisisEventNatsProperties(
    @NotBlank String subject, @NotBlank String stream, @NotNull Duration duplicateWindow) {}
