package com.serenity.escalation.model;

import java.util.UUID;

public record CrisisOutboxEventRecord(
    UUID eventId, String eventType, String aggregateKey, String payloadJson, int attemptCount) {}
