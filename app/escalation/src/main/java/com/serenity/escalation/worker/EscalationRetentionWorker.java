package com.serenity.escalation.worker;

import com.serenity.escalation.service.EscalationRetentionService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crisis.retention.enabled", havingValue = "true")
public class EscalationRetentionWorker {

  private final EscalationRetentionService retentionService;

  @Scheduled(fixedDelayString = "${crisis.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
