/*
 * Where: escalation service layer
 * What: escalation deadlines backed by the escalation task scheduler
 * Why: a deadline fires at its instant instead of waiting for the next sweep
 */
package com.serenity.escalation.service;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class SchedulerEscalationTimers implements EscalationTimers {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerEscalationTimers.class);

  private final TaskScheduler scheduler;
  private final ConcurrentMap<UUID, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

  public SchedulerEscalationTimers(@Qualifier("escalationTaskScheduler") TaskScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  public void arm(UUID crisisAlertId, Instant fireAt, Runnable task) {
    final AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
    final ScheduledFuture<?> future =
        scheduler.schedule(
            () -> {
              pending.remove(crisisAlertId, self.get());
              fire(crisisAlertId, task);
            },
            fireAt);
    self.set(future);
    final ScheduledFuture<?> previous = pending.put(crisisAlertId, future);
    if (previous != null && previous != future) {
      previous.cancel(false);
    }
    logger.debug("escalation timer armed crisisAlertId={} fireAt={}", crisisAlertId, fireAt);
  }

  @Override
  public void disarm(UUID crisisAlertId) {
    final ScheduledFuture<?> future = pending.remove(crisisAlertId);
    if (future != null) {
      future.cancel(false);
      logger.debug("escalation timer disarmed crisisAlertId={}", crisisAlertId);
    }
  }

  @Override
  public boolean isArmed(UUID crisisAlertId) {
    final ScheduledFuture<?> future = pending.get(crisisAlertId);
    return future != null && !future.isDone();
  }

  private void fire(UUID crisisAlertId, Runnable task) {
    try {
      task.run();
    } catch (RuntimeException ex) {
      // the sweep picks the alert up again
      logger.error("escalation timer task failed crisisAlertId={}", crisisAlertId, ex);
    }
  }
}
