package com.serenity.escalation.worker;

import com.serenity.escalation.service.EscalationStateMachine;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Re-arms escalation timers from persisted deadlines and evaluates overdue alerts. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "crisis.escalation.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class EscalationSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(EscalationSweepWorker.class);

  private final EscalationStateMachine stateMachine;

  @Scheduled(
      initialDelayString = "${crisis.escalation.sweep-interval}",
      fixedDelayString = "${crisis.escalation.sweep-interval}")
  public void run() {
    final int evaluated = stateMachine.sweep();
    if (evaluated > 0) {
      logger.info("escalation sweep evaluated overdue alerts count={}", evaluated);
    }
  }
}
