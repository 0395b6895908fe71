package com.serenity.escalation.service;

import java.time.Instant;
import java.util.UUID;

/**
 * One pending deadline per crisis alert. Arming again replaces the previous deadline; the sweep
 * re-arms alerts whose timer was lost on restart.
 */
public interface EscalationTimers {

  void arm(UUID crisisAlertId, Instant fireAt, Runnable task);

  void disarm(UUID crisisAlertId);

  boolean isArmed(UUID crisisAlertId);
}
