/*
 * Where: escalation model
 * What: snapshot of a notification_queue row
 * Why: shared by the claim query, the processor and the status API
 */
package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

@Builder(toBuilder = true)
public record QueueItemRecord(
    UUID queueItemId,
    long seq,
    UUID requestId,
    UUID crisisAlertId,
    UUID recipientId,
    QueueItemStatus status,
    int priority,
    Instant scheduledFor,
    int retryCount,
    int maxRetries,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    String deliveryId,
    String lastError,
    Instant processedAt,
    Instant createdAt) {}
