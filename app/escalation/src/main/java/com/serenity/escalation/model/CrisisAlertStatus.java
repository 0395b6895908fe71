/*
 * Where: escalation model
 * What: crisis alert lifecycle states and the forward-only transition table
 * Why: every status write is checked against one table before reaching SQL
 */
package com.serenity.escalation.model;

import java.util.EnumSet;
import java.util.Set;

public enum CrisisAlertStatus {
  SCHEDULED,
  SENT,
  ACKNOWLEDGED,
  ESCALATED,
  RESOLVED,
  CANCELLED;

  /** States in which the escalation timer is running. */
  public static final Set<CrisisAlertStatus> ESCALATING = EnumSet.of(SCHEDULED, SENT, ESCALATED);

  /** States that still accept a resolve. */
  public static final Set<CrisisAlertStatus> OPEN =
      EnumSet.of(SCHEDULED, SENT, ESCALATED, ACKNOWLEDGED);

  public boolean isTerminal() {
    return this == RESOLVED || this == CANCELLED;
  }

  public boolean canTransitionTo(CrisisAlertStatus target) {
    return switch (this) {
      case SCHEDULED -> target != SCHEDULED;
      case SENT -> target != SCHEDULED && target != SENT;
      case ESCALATED -> target != SCHEDULED && target != SENT;
      case ACKNOWLEDGED -> target == RESOLVED;
      case RESOLVED, CANCELLED -> false;
    };
  }
}
