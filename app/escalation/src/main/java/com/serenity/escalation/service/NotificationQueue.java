/*
 * Where: escalation service layer
 * What: durable notification queue operations with an audit row per transition
 * Why: the processor, the state machine and the status API share one place that writes queue state
 */
package com.serenity.escalation.service;

import com.serenity.escalation.config.NotificationQueueProperties;
import com.serenity.escalation.model.ClaimedQueueItem;
import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.QueueAuditRecord;
import com.serenity.escalation.model.QueueItemRecord;
import com.serenity.escalation.model.QueueItemStatus;
import com.serenity.escalation.model.RecipientRecord;
import com.serenity.escalation.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class NotificationQueue {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueue.class);

  private final NotificationQueueRepository repository;
  private final NotificationQueueProperties properties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public NotificationQueue(
      NotificationQueueRepository repository,
      NotificationQueueProperties properties,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.repository = repository;
    this.properties = properties;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  public QueueItemRecord enqueue(
      CrisisAlertRecord alert, RecipientRecord recipient, Instant scheduledFor) {
    final Instant now = Instant.now(clock);
    final QueueItemRecord item =
        QueueItemRecord.builder()
            .queueItemId(UUID.randomUUID())
            .requestId(alert.requestId())
            .crisisAlertId(alert.crisisAlertId())
            .recipientId(recipient.recipientId())
            .status(QueueItemStatus.QUEUED)
            .priority(alert.severity().queuePriority())
            .scheduledFor(scheduledFor)
            .retryCount(0)
            .maxRetries(properties.maxRetries())
            .createdAt(now)
            .build();
    return transactionTemplate.execute(
        status -> {
          final QueueItemRecord stored = repository.insert(item);
          audit(stored.queueItemId(), null, QueueItemStatus.QUEUED, "enqueued", now);
          return stored;
        });
  }

  /** Leases due items to {@code lockedBy}, highest priority first. */
  public List<QueueItemRecord> claimDue(int limit, String lockedBy) {
    final Instant now = Instant.now(clock);
    final Instant leaseUntil = now.plus(properties.lease());
    return transactionTemplate.execute(
        status -> {
          final List<ClaimedQueueItem> claimed =
              repository.claimDue(limit, now, leaseUntil, lockedBy);
          final List<QueueItemRecord> items = new ArrayList<>(claimed.size());
          for (ClaimedQueueItem claim : claimed) {
            String detail = "claimed by " + lockedBy;
            if (claim.reclaimed()) {
              detail = "reclaimed by " + lockedBy + " from " + claim.previousOwner();
              logger.warn(
                  "queue item lease expired, reclaiming queueItemId={} previousOwner={}",
                  claim.item().queueItemId(),
                  claim.previousOwner());
            }
            audit(
                claim.item().queueItemId(),
                claim.previousStatus(),
                QueueItemStatus.PROCESSING,
                detail,
                now);
            items.add(claim.item());
          }
          return items;
        });
  }

  public boolean markSent(QueueItemRecord item, String lockedBy, String deliveryId) {
    final Instant now = Instant.now(clock);
    return transition(
        item,
        QueueItemStatus.SENT,
        "deliveryId=" + deliveryId,
        now,
        () -> repository.markSent(item.queueItemId(), lockedBy, deliveryId, now));
  }

  public boolean markRetry(
      QueueItemRecord item, String lockedBy, int retryCount, Instant scheduledFor, String error) {
    final Instant now = Instant.now(clock);
    return transition(
        item,
        QueueItemStatus.QUEUED,
        "retry " + retryCount + " at " + scheduledFor + ": " + error,
        now,
        () -> repository.markRetry(item.queueItemId(), lockedBy, retryCount, scheduledFor, error));
  }

  public boolean markFailed(QueueItemRecord item, String lockedBy, int retryCount, String error) {
    final Instant now = Instant.now(clock);
    return transition(
        item,
        QueueItemStatus.FAILED,
        error,
        now,
        () -> repository.markFailed(item.queueItemId(), lockedBy, retryCount, error, now));
  }

  public boolean markCancelled(QueueItemRecord item, String lockedBy, String reason) {
    final Instant now = Instant.now(clock);
    return transition(
        item,
        QueueItemStatus.CANCELLED,
        reason,
        now,
        () -> repository.markCancelled(item.queueItemId(), lockedBy, now));
  }

  /** Cancels every item of the alert that has not been claimed yet. */
  public int cancelOutstanding(UUID crisisAlertId, String reason) {
    final Instant now = Instant.now(clock);
    return transactionTemplate.execute(
        status -> {
          final List<UUID> cancelled = repository.cancelQueued(crisisAlertId, now);
          for (UUID queueItemId : cancelled) {
            audit(queueItemId, QueueItemStatus.QUEUED, QueueItemStatus.CANCELLED, reason, now);
          }
          return cancelled.size();
        });
  }

  public void markDelivered(UUID recipientId) {
    final int updated = repository.markDelivered(recipientId, Instant.now(clock));
    if (updated == 0) {
      logger.debug("no sent queue item to mark delivered recipientId={}", recipientId);
    }
  }

  public List<QueueItemRecord> findByCrisisAlertId(UUID crisisAlertId) {
    return repository.findByCrisisAlertId(crisisAlertId);
  }

  public long countByStatus(QueueItemStatus status) {
    return repository.countByStatus(status);
  }

  private boolean transition(
      QueueItemRecord item,
      QueueItemStatus target,
      String detail,
      Instant now,
      IntSupplier update) {
    final Boolean applied =
        transactionTemplate.execute(
            status -> {
              if (update.getAsInt() == 0) {
                return false;
              }
              audit(item.queueItemId(), QueueItemStatus.PROCESSING, target, detail, now);
              return true;
            });
    if (!Boolean.TRUE.equals(applied)) {
      logger.warn(
          "queue item lease lost queueItemId={} target={}", item.queueItemId(), target);
      return false;
    }
    return true;
  }

  private void audit(
      UUID queueItemId, QueueItemStatus from, QueueItemStatus to, String detail, Instant now) {
    repository.insertAudit(new QueueAuditRecord(queueItemId, from, to, detail, now));
  }
}
