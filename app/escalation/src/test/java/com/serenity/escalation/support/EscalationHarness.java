package com.serenity.escalation.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.serenity.escalation.config.EscalationProperties;
import com.serenity.escalation.config.NotificationQueueProperties;
import com.serenity.escalation.model.Severity;
import com.serenity.escalation.service.ChannelDispatcher;
import com.serenity.escalation.service.CrisisAlertLocks;
import com.serenity.escalation.service.CrisisAlertService;
import com.serenity.escalation.service.DeliveryTracker;
import com.serenity.escalation.service.EscalationMetrics;
import com.serenity.escalation.service.EscalationStateMachine;
import com.serenity.escalation.service.NotificationMessageRenderer;
import com.serenity.escalation.service.NotificationQueue;
import com.serenity.escalation.service.NotificationQueueProcessor;
import com.serenity.escalation.service.ResponseCoordinator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Wires the escalation services over in-memory repositories, a hand-driven clock and manual
 * timers so that whole alert lifecycles run inside one test thread.
 */
public class EscalationHarness {

  public static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  public final MutableClock clock = new MutableClock(FIXED_NOW);
  public final InMemoryNotificationRequestRepository requests =
      new InMemoryNotificationRequestRepository();
  public final InMemoryRecipientRepository recipients = new InMemoryRecipientRepository();
  public final InMemoryCrisisAlertRepository alerts = new InMemoryCrisisAlertRepository();
  public final InMemoryNotificationQueueRepository queueRows =
      new InMemoryNotificationQueueRepository();
  public final InMemoryDeliveryStatusRepository deliveries = new InMemoryDeliveryStatusRepository();
  public final InMemorySupporterResponseRepository responses =
      new InMemorySupporterResponseRepository();
  public final StaticRecipientDirectory directory = new StaticRecipientDirectory();
  public final ManualEscalationTimers timers = new ManualEscalationTimers();
  public final RecordingCrisisEventSink events = new RecordingCrisisEventSink();
  public final ScriptedChannelSender sender = new ScriptedChannelSender();
  public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  public final NotificationQueueProperties queueProperties;
  public final EscalationProperties escalationProperties;
  public final EscalationMetrics metrics;
  public final NotificationQueue queue;
  public final DeliveryTracker tracker;
  public final EscalationStateMachine stateMachine;
  public final ResponseCoordinator coordinator;
  public final NotificationQueueProcessor processor;
  public final CrisisAlertService service;

  public EscalationHarness() {
    final NoOpTransactionManager transactionManager = new NoOpTransactionManager();
    final CrisisAlertLocks locks = new CrisisAlertLocks();
    queueProperties =
        new NotificationQueueProperties(
            true,
            Duration.ofSeconds(1),
            10,
            3,
            Duration.ofSeconds(5),
            Duration.ofMinutes(5),
            Duration.ofSeconds(60),
            Duration.ofSeconds(5),
            2,
            500);
    escalationProperties =
        new EscalationProperties(
            true,
            Duration.ofSeconds(15),
            Duration.ofHours(24),
            1,
            Map.of(
                Severity.CRITICAL,
                List.of(Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(90)),
                Severity.HIGH,
                List.of(Duration.ofSeconds(60), Duration.ofSeconds(120)),
                Severity.MEDIUM,
                List.of(Duration.ofSeconds(120), Duration.ofSeconds(300)),
                Severity.LOW,
                List.of(Duration.ofSeconds(120), Duration.ofSeconds(300))));
    metrics = new EscalationMetrics(meterRegistry);
    queue = new NotificationQueue(queueRows, queueProperties, transactionManager, clock);
    tracker = new DeliveryTracker(deliveries, recipients, clock);
    stateMachine =
        new EscalationStateMachine(
            requests,
            recipients,
            alerts,
            responses,
            directory,
            queue,
            tracker,
            timers,
            locks,
            events,
            escalationProperties,
            metrics,
            transactionManager,
            clock);
    coordinator =
        new ResponseCoordinator(
            alerts,
            responses,
            recipients,
            requests,
            tracker,
            stateMachine,
            locks,
            events,
            metrics,
            transactionManager,
            clock);
    processor =
        new NotificationQueueProcessor(
            queue,
            alerts,
            recipients,
            requests,
            new NotificationMessageRenderer(),
            new ChannelDispatcher(List.of(sender), Runnable::run),
            tracker,
            stateMachine,
            queueProperties,
            metrics,
            clock);
    service =
        new CrisisAlertService(
            stateMachine,
            coordinator,
            tracker,
            queue,
            requests,
            alerts,
            recipients,
            clock,
            new ObjectMapper());
  }

  /** Moves the clock and fires the timers that became due. */
  public void advance(Duration duration) {
    clock.advance(duration);
    timers.fireDue(clock.instant());
  }

  /** Drains every item that is due now. */
  public int drainQueue() {
    int total = 0;
    int claimed;
    do {
      claimed = processor.processDueBatch();
      total += claimed;
    } while (claimed > 0 && total < 1_000);
    return total;
  }
}
