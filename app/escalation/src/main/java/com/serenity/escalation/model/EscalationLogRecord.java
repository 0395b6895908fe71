package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;

public record EscalationLogRecord(
    UUID logId,
    UUID crisisAlertId,
    int previousTier,
    int newTier,
    EscalationReason reason,
    Instant escalatedAt) {}
