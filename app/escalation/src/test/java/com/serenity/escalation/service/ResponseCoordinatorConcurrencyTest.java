package com.serenity.escalation.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.serenity.escalation.api.request.TriggerCrisisAlertRequest;
import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.CrisisEventType;
import com.serenity.escalation.model.ResponseSubmission;
import com.serenity.escalation.model.ResponseType;
import com.serenity.escalation.support.EscalationHarness;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;

class ResponseCoordinatorConcurrencyTest {

  private static final int RESPONDERS = 8;

  private EscalationHarness harness;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    harness = new EscalationHarness();
    final List<String> tierOne = new ArrayList<>();
    for (int i = 0; i < RESPONDERS; i++) {
      tierOne.add("sup-" + i);
    }
    harness.directory.withNetwork("user-1", List.of(tierOne));
    executor = Executors.newFixedThreadPool(RESPONDERS);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @RepeatedTest(5)
  void concurrentAcknowledgementsElectExactlyOneFirstResponder() throws Exception {
    final UUID alertId =
        UUID.fromString(
            harness
                .service
                .trigger(
                    new TriggerCrisisAlertRequest(
                        "user-1", null, "crisis", "critical", null, null, null))
                .crisisAlertId());
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<ResponseSubmission>> futures = new ArrayList<>();
    for (int i = 0; i < RESPONDERS; i++) {
      final String responderId = "sup-" + i;
      futures.add(
          executor.submit(
              () -> {
                start.await();
                return harness.coordinator.submit(
                    alertId, responderId, ResponseType.ACKNOWLEDGED, null);
              }));
    }
    start.countDown();

    final List<ResponseSubmission> results = new ArrayList<>();
    for (Future<ResponseSubmission> future : futures) {
      results.add(future.get(10, TimeUnit.SECONDS));
    }

    assertThat(results).allMatch(ResponseSubmission::accepted);
    assertThat(results).filteredOn(ResponseSubmission::firstResponder).hasSize(1);
    final CrisisAlertRecord alert = harness.alerts.findById(alertId).orElseThrow();
    assertThat(alert.status()).isEqualTo(CrisisAlertStatus.ACKNOWLEDGED);
    assertThat(alert.responderCount()).isEqualTo(RESPONDERS);
    assertThat(alert.firstResponderId()).isNotNull();
    assertThat(harness.events.ofType(alertId, CrisisEventType.ALERT_ACKNOWLEDGED)).hasSize(1);
    assertThat(harness.events.ofType(alertId, CrisisEventType.RESPONSE_RECORDED))
        .hasSize(RESPONDERS);
  }
}
