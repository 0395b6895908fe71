/*
 * Where: escalation model
 * What: latest delivery status of one recipient (realtime_delivery_status row)
 * Why: status queries and tier checks read this view instead of replaying delivery_events
 */
package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

@Builder(toBuilder = true)
public record DeliveryStatusRecord(
    UUID recipientId,
    UUID requestId,
    int tier,
    String connectionId,
    DeliveryState state,
    String deliveryId,
    Instant sentAt,
    Instant deliveredAt,
    Instant ackedAt,
    Instant failedAt,
    String lastReason,
    Instant updatedAt) {}
