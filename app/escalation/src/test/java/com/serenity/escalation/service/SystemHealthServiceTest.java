package com.serenity.escalation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.serenity.escalation.config.HealthProperties;
import com.serenity.escalation.model.HealthStatus;
import com.serenity.escalation.model.QueueItemStatus;
import com.serenity.escalation.model.SystemHealthSnapshot;
import com.serenity.escalation.repository.CrisisAlertRepository;
import com.serenity.escalation.repository.NotificationQueueRepository;
import com.serenity.escalation.repository.SupporterResponseRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SystemHealthServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private NotificationQueueRepository queueRepository;
  @Mock private CrisisAlertRepository alertRepository;
  @Mock private SupporterResponseRepository responseRepository;

  private SystemHealthService service;

  @BeforeEach
  void setUp() {
    service =
        new SystemHealthService(
            queueRepository,
            alertRepository,
            responseRepository,
            new HealthProperties(10, 100, Duration.ofHours(24)),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void healthyAtThresholds() {
    stub(100, 10, 3, 42.5);

    final SystemHealthSnapshot snapshot = service.snapshot();

    assertThat(snapshot.status()).isEqualTo(HealthStatus.HEALTHY);
    assertThat(snapshot.queuedCount()).isEqualTo(100);
    assertThat(snapshot.failedCount()).isEqualTo(10);
    assertThat(snapshot.activeCrises()).isEqualTo(3);
    assertThat(snapshot.averageResponseSeconds()).isEqualTo(42.5);
    assertThat(snapshot.checkedAt()).isEqualTo(FIXED_NOW);
  }

  @Test
  void backlogAboveThresholdWarns() {
    stub(101, 0, 0, null);

    assertThat(service.snapshot().status()).isEqualTo(HealthStatus.WARNING);
  }

  @Test
  void failuresDegradeEvenWithBacklog() {
    stub(500, 11, 1, null);

    final SystemHealthSnapshot snapshot = service.snapshot();

    assertThat(snapshot.status()).isEqualTo(HealthStatus.DEGRADED);
    assertThat(snapshot.averageResponseSeconds()).isNull();
  }

  private void stub(long queued, long failed, long active, Double average) {
    when(queueRepository.countByStatus(QueueItemStatus.QUEUED)).thenReturn(queued);
    when(queueRepository.countByStatus(QueueItemStatus.FAILED)).thenReturn(failed);
    when(alertRepository.countActive()).thenReturn(active);
    when(responseRepository.averageFirstResponseSeconds(any())).thenReturn(average);
  }
}
