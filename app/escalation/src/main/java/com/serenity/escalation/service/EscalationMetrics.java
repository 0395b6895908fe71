/*
 * Where: escalation service layer
 * What: alert, escalation, delivery, response and outbox metrics
 * Why: escalation latency and delivery failure rates are watched from Prometheus
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.EscalationReason;
import com.serenity.escalation.model.ResponseType;
import com.serenity.escalation.model.Severity;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a Spring-managed shared component")
public class EscalationMetrics {

  private static final String METRIC_ALERT_CREATED = "crisis.alert.created.total";
  private static final String METRIC_ALERT_NO_RECIPIENTS = "crisis.alert.no_recipients.total";
  private static final String METRIC_ALERT_CLOSED = "crisis.alert.closed.total";
  private static final String METRIC_ALERT_ACKNOWLEDGED = "crisis.alert.acknowledged.total";
  private static final String METRIC_TIER_ESCALATED = "crisis.tier.escalated.total";
  private static final String METRIC_TIERS_EXHAUSTED = "crisis.tiers.exhausted.total";
  private static final String METRIC_DELIVERY = "crisis.delivery.total";
  private static final String METRIC_RESPONSE = "crisis.response.total";
  private static final String METRIC_FIRST_RESPONSE_DELAY = "crisis.response.first.delay";
  private static final String METRIC_QUEUE_BACKLOG = "crisis.queue.backlog.current";
  private static final String METRIC_OUTBOX_FAILED = "crisis.outbox.failed.current";
  private static final String METRIC_OUTBOX_PUBLISH_DELAY = "crisis.outbox.publish.delay";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final AtomicLong queueBacklog = new AtomicLong(0);
  private final AtomicLong outboxFailed = new AtomicLong(0);
  private final Counter noRecipientsCounter;
  private final Counter acknowledgedCounter;
  private final Counter tiersExhaustedCounter;
  private final Timer firstResponseDelayTimer;
  private final Timer outboxPublishDelayTimer;

  public EscalationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_BACKLOG, queueBacklog, AtomicLong::get)
        .description("Queued notifications waiting for delivery")
        .register(meterRegistry);
    Gauge.builder(METRIC_OUTBOX_FAILED, outboxFailed, AtomicLong::get)
        .description("Lifecycle events that could not be published")
        .register(meterRegistry);
    this.noRecipientsCounter =
        Counter.builder(METRIC_ALERT_NO_RECIPIENTS)
            .description("Alerts opened without any recipient")
            .register(meterRegistry);
    this.acknowledgedCounter =
        Counter.builder(METRIC_ALERT_ACKNOWLEDGED)
            .description("Alerts acknowledged by a responder")
            .register(meterRegistry);
    this.tiersExhaustedCounter =
        Counter.builder(METRIC_TIERS_EXHAUSTED)
            .description("Alerts that ran out of tiers without a response")
            .register(meterRegistry);
    this.firstResponseDelayTimer =
        Timer.builder(METRIC_FIRST_RESPONSE_DELAY)
            .description("Delay from alert creation to the first engaging response")
            .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Delay from event occurrence to JetStream publish")
            .register(meterRegistry);
  }

  public void recordAlertCreated(Severity severity) {
    counter(METRIC_ALERT_CREATED, "Alerts opened", Tags.of("severity", severity.name())).increment();
  }

  public void recordNoRecipients() {
    noRecipientsCounter.increment();
  }

  public void recordAcknowledged() {
    acknowledgedCounter.increment();
  }

  public void recordClosed(CrisisAlertStatus status, String resolution) {
    counter(
            METRIC_ALERT_CLOSED,
            "Alerts resolved or cancelled",
            Tags.of("status", status.name(), "resolution", resolution == null ? "none" : resolution))
        .increment();
  }

  public void recordEscalation(EscalationReason reason) {
    counter(METRIC_TIER_ESCALATED, "Tier escalations", Tags.of("reason", reason.value()))
        .increment();
  }

  public void recordTiersExhausted() {
    tiersExhaustedCounter.increment();
  }

  public void recordDeliveryResult(String result) {
    counter(METRIC_DELIVERY, "Queue item delivery outcomes", Tags.of("result", result)).increment();
  }

  public void recordResponse(ResponseType type, boolean firstResponder) {
    counter(
            METRIC_RESPONSE,
            "Supporter responses",
            Tags.of("type", type.name(), "first_responder", String.valueOf(firstResponder)))
        .increment();
  }

  public void recordFirstResponseDelay(Instant alertCreatedAt, Instant respondedAt) {
    if (alertCreatedAt == null || respondedAt == null || respondedAt.isBefore(alertCreatedAt)) {
      return;
    }
    firstResponseDelayTimer.record(Duration.between(alertCreatedAt, respondedAt));
  }

  public void recordOutboxPublishDelay(Instant occurredAt, Instant publishedAt) {
    if (occurredAt == null || publishedAt == null || publishedAt.isBefore(occurredAt)) {
      return;
    }
    outboxPublishDelayTimer.record(Duration.between(occurredAt, publishedAt));
  }

  public void updateQueueBacklog(long queued) {
    queueBacklog.set(Math.max(queued, 0));
  }

  public void updateOutboxFailed(long failed) {
    outboxFailed.set(Math.max(failed, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
