/*
 * Where: escalation workers
 * What: drives the queue processor on a fixed delay
 * Why: due notifications are sent without waiting for an external trigger
 */
package com.serenity.escalation.worker;

import com.serenity.escalation.service.NotificationQueueProcessor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crisis.queue.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationQueueWorker {

  private final NotificationQueueProcessor processor;

  @Scheduled(fixedDelayString = "${crisis.queue.poll-interval}")
  public void run() {
    processor.processDueBatch();
  }
}
