/*
 * Where: escalation configuration binding
 * What: tier windows per severity, sweep cadence and maximum alert lifetime
 * Why: escalation timing is an operational policy, not code
 */
package com.serenity.escalation.config;

import com.serenity.escalation.model.Severity;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "crisis.escalation")
@Validated
public record EscalationProperties(
    boolean enabled,
    @NotNull Duration sweepInterval,
    @NotNull Duration maxLifetime,
    @NotNull @Positive Integer timerPoolSize,
    @NotEmpty Map<Severity, List<Duration>> tierWindows) {

  public EscalationProperties {
    tierWindows = tierWindows == null ? Map.of() : Map.copyOf(tierWindows);
  }

  /**
   * Response window for the given tier. Tiers deeper than the configured list reuse the last
   * window.
   */
  public Duration window(Severity severity, int tier) {
    final List<Duration> windows = tierWindows.get(severity);
    if (windows == null || windows.isEmpty()) {
      throw new IllegalStateException("no tier windows configured for severity " + severity);
    }
    final int index = Math.min(Math.max(tier, 1), windows.size()) - 1;
    return windows.get(index);
  }

  @AssertTrue(message = "crisis.escalation.tier-windows must define every severity")
  public boolean isEverySeverityConfigured() {
    return tierWindows.keySet().containsAll(EnumSet.allOf(Severity.class));
  }

  @AssertTrue(message = "crisis.escalation.tier-windows must be positive and non-decreasing")
  public boolean isTierWindowsNonDecreasing() {
    for (List<Duration> windows : tierWindows.values()) {
      if (windows == null || windows.isEmpty()) {
        return false;
      }
      Duration previous = Duration.ZERO;
      for (Duration window : windows) {
        if (window == null || window.isZero() || window.isNegative()) {
          return false;
        }
        if (window.compareTo(previous) < 0) {
          return false;
        }
        previous = window;
      }
    }
    return true;
  }

  @AssertTrue(message = "crisis.escalation.sweep-interval must be positive")
  public boolean isSweepIntervalPositive() {
    return sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative();
  }
}
