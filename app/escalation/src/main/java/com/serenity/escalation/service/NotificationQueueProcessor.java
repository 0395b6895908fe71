/*
 * Where: escalation service layer
 * What: claims due queue items, sends them and records the outcome
 * Why: transient failures retry with exponential backoff; permanent ones feed tier escalation
 */
package com.serenity.escalation.service;

import com.google.common.annotations.VisibleForTesting;
import com.serenity.escalation.config.NotificationQueueProperties;
import com.serenity.escalation.model.ChannelMessage;
import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.NotificationRequestRecord;
import com.serenity.escalation.model.QueueItemRecord;
import com.serenity.escalation.model.QueueItemStatus;
import com.serenity.escalation.model.RecipientRecord;
import com.serenity.escalation.repository.CrisisAlertRepository;
import com.serenity.escalation.repository.NotificationRequestRepository;
import com.serenity.escalation.repository.RecipientRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class NotificationQueueProcessor {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueueProcessor.class);

  private final NotificationQueue queue;
  private final CrisisAlertRepository alertRepository;
  private final RecipientRepository recipientRepository;
  private final NotificationRequestRepository requestRepository;
  private final NotificationMessageRenderer renderer;
  private final ChannelDispatcher dispatcher;
  private final DeliveryTracker tracker;
  private final EscalationStateMachine stateMachine;
  private final NotificationQueueProperties properties;
  private final EscalationMetrics metrics;
  private final Clock clock;
  private final String lockedBy;

  public NotificationQueueProcessor(
      NotificationQueue queue,
      CrisisAlertRepository alertRepository,
      RecipientRepository recipientRepository,
      NotificationRequestRepository requestRepository,
      NotificationMessageRenderer renderer,
      ChannelDispatcher dispatcher,
      DeliveryTracker tracker,
      EscalationStateMachine stateMachine,
      NotificationQueueProperties properties,
      EscalationMetrics metrics,
      Clock clock) {
    this.queue = queue;
    this.alertRepository = alertRepository;
    this.recipientRepository = recipientRepository;
    this.requestRepository = requestRepository;
    this.renderer = renderer;
    this.dispatcher = dispatcher;
    this.tracker = tracker;
    this.stateMachine = stateMachine;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.lockedBy = WorkerIdentity.resolve();
  }

  /** Processes one batch; returns the number of items claimed. */
  public int processDueBatch() {
    final List<QueueItemRecord> items = queue.claimDue(properties.batchSize(), lockedBy);
    for (QueueItemRecord item : items) {
      MDC.put("crisis_alert_id", item.crisisAlertId().toString());
      try {
        processItem(item);
      } catch (RuntimeException ex) {
        // the lease expires and the item is claimed again
        logger.error(
            "queue item processing failed queueItemId={} crisisAlertId={}",
            item.queueItemId(),
            item.crisisAlertId(),
            ex);
      } finally {
        MDC.remove("crisis_alert_id");
      }
    }
    metrics.updateQueueBacklog(queue.countByStatus(QueueItemStatus.QUEUED));
    return items.size();
  }

  @VisibleForTesting
  void processItem(QueueItemRecord item) {
    final CrisisAlertRecord alert = alertRepository.findById(item.crisisAlertId()).orElse(null);
    if (alert == null || alert.status().isTerminal()) {
      if (queue.markCancelled(item, lockedBy, "alert closed before send")) {
        metrics.recordDeliveryResult("cancelled");
      }
      return;
    }
    final RecipientRecord recipient = recipientRepository.findById(item.recipientId()).orElse(null);
    final NotificationRequestRecord request =
        requestRepository.findById(item.requestId()).orElse(null);
    if (recipient == null || request == null) {
      logger.error(
          "queue item references missing rows queueItemId={} recipientId={} requestId={}",
          item.queueItemId(),
          item.recipientId(),
          item.requestId());
      queue.markFailed(item, lockedBy, item.retryCount(), "recipient or request missing");
      metrics.recordDeliveryResult("failed");
      return;
    }

    if (item.leaseUntil() != null && !Instant.now(clock).isBefore(item.leaseUntil())) {
      // another worker may already hold this row; it is left for the reclaim
      metrics.recordDeliveryResult("lease_expired");
      logger.warn(
          "queue item lease expired before send queueItemId={} leaseUntil={}",
          item.queueItemId(),
          item.leaseUntil());
      return;
    }

    final ChannelMessage message = renderer.render(item, recipient, request);
    final String deliveryId;
    try {
      deliveryId = dispatcher.dispatch(message, properties.senderTimeout());
    } catch (PermanentChannelDeliveryException ex) {
      handlePermanentFailure(item, recipient, ex);
      return;
    } catch (RuntimeException ex) {
      handleTransientFailure(item, recipient, ex);
      return;
    }

    if (!queue.markSent(item, lockedBy, deliveryId)) {
      return;
    }
    tracker.recordSent(recipient.recipientId(), deliveryId);
    metrics.recordDeliveryResult("sent");
    logger.info(
        "notification sent queueItemId={} recipientId={} tier={} channel={}",
        item.queueItemId(),
        recipient.recipientId(),
        recipient.tier(),
        recipient.channel());
    stateMachine.onDeliverySucceeded(item.crisisAlertId(), recipient.tier());
  }

  private void handlePermanentFailure(
      QueueItemRecord item, RecipientRecord recipient, RuntimeException ex) {
    final String error = truncateError(ex);
    if (!queue.markFailed(item, lockedBy, item.retryCount(), error)) {
      return;
    }
    tracker.recordFailed(recipient.recipientId(), error);
    metrics.recordDeliveryResult("failed");
    logger.warn(
        "notification failed permanently queueItemId={} recipientId={} tier={} error={}",
        item.queueItemId(),
        recipient.recipientId(),
        recipient.tier(),
        error);
    stateMachine.onDeliveryFailed(item.crisisAlertId(), recipient.tier());
  }

  private void handleTransientFailure(
      QueueItemRecord item, RecipientRecord recipient, RuntimeException ex) {
    final String error = truncateError(ex);
    final int retryCount = item.retryCount() + 1;
    if (retryCount < item.maxRetries()) {
      final Instant scheduledFor = Instant.now(clock).plus(computeBackoff(retryCount));
      if (queue.markRetry(item, lockedBy, retryCount, scheduledFor, error)) {
        metrics.recordDeliveryResult("retry");
        logger.warn(
            "notification send failed, retry scheduled queueItemId={} retryCount={} at={} error={}",
            item.queueItemId(),
            retryCount,
            scheduledFor,
            error);
      }
      return;
    }
    if (!queue.markFailed(item, lockedBy, retryCount, error)) {
      return;
    }
    tracker.recordFailed(recipient.recipientId(), "retries exhausted: " + error);
    metrics.recordDeliveryResult("exhausted");
    logger.error(
        "notification retries exhausted queueItemId={} recipientId={} retryCount={} error={}",
        item.queueItemId(),
        recipient.recipientId(),
        retryCount,
        error);
    stateMachine.onDeliveryExhausted(item.crisisAlertId(), recipient.recipientId(), recipient.tier());
  }

  /** Delay before retry number {@code retryCount}: base doubled per retry, capped at backoff-max. */
  @VisibleForTesting
  Duration computeBackoff(int retryCount) {
    final long baseMillis = Math.max(properties.backoffBase().toMillis(), 1);
    final long maxMillis = properties.backoffMax().toMillis();
    final int exponent = Math.max(0, retryCount);
    if (exponent >= 62 || (1L << exponent) > maxMillis / baseMillis) {
      return properties.backoffMax();
    }
    return Duration.ofMillis(Math.min(baseMillis << exponent, maxMillis));
  }

  private String truncateError(Exception ex) {
    final String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    final int max = properties.errorMessageMaxLength();
    return message.length() <= max ? message : message.substring(0, max);
  }
}
