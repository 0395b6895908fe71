/*
 * Where: escalation configuration binding
 * What: queue polling, retry/backoff, lease and sender timeout settings
 * Why: delivery pacing is tuned per environment
 */
package com.serenity.escalation.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "crisis.queue")
@Validated
public record NotificationQueueProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int maxRetries,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    @NotNull Duration lease,
    @NotNull Duration senderTimeout,
    @Positive int senderPoolSize,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "crisis.queue.backoff-max must not be shorter than backoff-base")
  public boolean isBackoffRangeValid() {
    return backoffBase == null || backoffMax == null || backoffMax.compareTo(backoffBase) >= 0;
  }

  /** A claimed batch is sent one item at a time; the lease has to outlast every send in it. */
  @AssertTrue(message = "crisis.queue.lease must cover batch-size times sender-timeout")
  public boolean isLeaseCoveringBatch() {
    if (lease == null || senderTimeout == null || batchSize <= 0) {
      return true;
    }
    return lease.compareTo(senderTimeout.multipliedBy(batchSize)) >= 0;
  }

  @AssertTrue(message = "crisis.queue.sender-timeout must be positive")
  public boolean isSenderTimeoutPositive() {
    return senderTimeout != null && !senderTimeout.isZero() && !senderTimeout.isNegative();
  }
}
