/*
 * Where: escalation service layer
 * What: striped in-process locks keyed by crisis alert id
 * Why: the state machine and the response coordinator are single writers per alert
 */
package com.serenity.escalation.service;

import com.google.common.util.concurrent.Striped;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
public class CrisisAlertLocks {

  private static final int STRIPES = 256;

  // ReentrantLock stripes: the coordinator calls back into the state machine while holding one
  private final Striped<Lock> locks = Striped.lazyWeakLock(STRIPES);

  public <T> T withLock(UUID crisisAlertId, Supplier<T> action) {
    final Lock lock = locks.get(crisisAlertId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void withLock(UUID crisisAlertId, Runnable action) {
    withLock(
        crisisAlertId,
        () -> {
          action.run();
          return null;
        });
  }
}
