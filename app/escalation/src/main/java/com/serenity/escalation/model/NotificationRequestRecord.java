/*
 * Where: escalation model
 * What: snapshot of a notification_requests row
 * Why: the subject's signal that every alert, recipient and queue item hangs off
 */
package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRequestRecord(
    UUID requestId,
    String subjectUserId,
    String subjectDisplayName,
    NotificationKind kind,
    String message,
    String customMessage,
    String locationJson,
    Instant createdAt,
    Instant closedAt) {}
