package com.serenity.escalation.worker;

import com.serenity.escalation.service.CrisisEventOutboxPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = {"crisis.outbox.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class CrisisEventOutboxWorker {

  private final CrisisEventOutboxPublisher publisher;

  @Scheduled(fixedDelayString = "${crisis.outbox.poll-interval}")
  public void run() {
    publisher.publishPendingBatch();
  }
}
