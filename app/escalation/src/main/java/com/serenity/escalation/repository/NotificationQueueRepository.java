/*
 * Where: escalation data access
 * What: persistence contract for notification_queue and its audit trail
 * Why: result writes carry the lock owner so a worker that lost its lease cannot overwrite another
 */
package com.serenity.escalation.repository;

import com.serenity.escalation.model.ClaimedQueueItem;
import com.serenity.escalation.model.QueueAuditRecord;
import com.serenity.escalation.model.QueueItemRecord;
import com.serenity.escalation.model.QueueItemStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NotificationQueueRepository {

  QueueItemRecord insert(QueueItemRecord record);

  Optional<QueueItemRecord> findById(UUID queueItemId);

  List<QueueItemRecord> findByCrisisAlertId(UUID crisisAlertId);

  /**
   * Claims due QUEUED items and PROCESSING items whose lease expired, ordered by priority, due
   * time and insertion order.
   */
  List<ClaimedQueueItem> claimDue(int limit, Instant now, Instant leaseUntil, String lockedBy);

  int markSent(UUID queueItemId, String lockedBy, String deliveryId, Instant now);

  int markRetry(
      UUID queueItemId, String lockedBy, int retryCount, Instant scheduledFor, String lastError);

  int markFailed(
      UUID queueItemId, String lockedBy, int retryCount, String lastError, Instant now);

  int markCancelled(UUID queueItemId, String lockedBy, Instant now);

  /** Moves the SENT item of the recipient to DELIVERED. */
  int markDelivered(UUID recipientId, Instant now);

  /** Cancels every QUEUED item of the alert and returns the ids that were cancelled. */
  List<UUID> cancelQueued(UUID crisisAlertId, Instant now);

  long countByStatus(QueueItemStatus status);

  void insertAudit(QueueAuditRecord record);

  List<QueueAuditRecord> findAudit(UUID queueItemId);

  int deleteProcessedOlderThan(Instant threshold);
}
