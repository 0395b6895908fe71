package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;

public record QueueAuditRecord(
    UUID queueItemId,
    QueueItemStatus fromStatus,
    QueueItemStatus toStatus,
    String detail,
    Instant occurredAt) {}
