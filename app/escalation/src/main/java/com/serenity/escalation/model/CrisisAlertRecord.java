/*
 * Where: escalation model
 * What: snapshot of a crisis_alerts row
 * Why: the state machine and the coordinator reason over one immutable view per read
 */
package com.serenity.escalation.model;

import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

@Builder(toBuilder = true)
public record CrisisAlertRecord(
    UUID crisisAlertId,
    UUID requestId,
    Severity severity,
    CrisisAlertStatus status,
    int tier,
    int responderCount,
    String firstResponderId,
    int escalationLevel,
    Instant escalationDeadline,
    Instant expiresAt,
    String resolution,
    boolean tiersExhausted,
    Instant createdAt,
    Instant updatedAt) {}
