package com.serenity.escalation.service;

import com.serenity.escalation.config.HealthProperties;
import com.serenity.escalation.model.HealthStatus;
import com.serenity.escalation.model.QueueItemStatus;
import com.serenity.escalation.model.SystemHealthSnapshot;
import com.serenity.escalation.repository.CrisisAlertRepository;
import com.serenity.escalation.repository.NotificationQueueRepository;
import com.serenity.escalation.repository.SupporterResponseRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Operational summary of the notification pipeline.
 *
 * <p>Status is {@code DEGRADED} when permanently failed items exceed the failed threshold, {@code
 * WARNING} when the queued backlog exceeds the queued threshold, {@code HEALTHY} otherwise.
 */
@Service
@RequiredArgsConstructor
public class SystemHealthService {

  private final NotificationQueueRepository queueRepository;
  private final CrisisAlertRepository alertRepository;
  private final SupporterResponseRepository responseRepository;
  private final HealthProperties properties;
  private final Clock clock;

  public SystemHealthSnapshot snapshot() {
    final Instant now = Instant.now(clock);
    final long queued = queueRepository.countByStatus(QueueItemStatus.QUEUED);
    final long failed = queueRepository.countByStatus(QueueItemStatus.FAILED);
    final long active = alertRepository.countActive();
    final Double averageResponse =
        responseRepository.averageFirstResponseSeconds(now.minus(properties.responseTimeWindow()));
    return new SystemHealthSnapshot(
        classify(queued, failed), queued, failed, active, averageResponse, now);
  }

  private HealthStatus classify(long queued, long failed) {
    if (failed > properties.failedDegradedThreshold()) {
      return HealthStatus.DEGRADED;
    }
    if (queued > properties.queuedWarningThreshold()) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.HEALTHY;
  }
}
