/*
 * Where: escalation configuration binding
 * What: JetStream subscription settings for inbound delivery receipts
 * Why: redelivery windows are validated at startup
 */
package com.serenity.escalation.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "crisis.nats.receipts")
@Validated
public record DeliveryReceiptNatsProperties(
    boolean enabled,
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "crisis.nats.receipts.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "crisis.nats.receipts.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
