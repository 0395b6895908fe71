package com.serenity.escalation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "response DTO is serialized once")
public record CrisisAlertResponse(
    String crisisAlertId,
    String requestId,
    String status,
    String severity,
    int tier,
    int escalationLevel,
    int responderCount,
    String firstResponderId,
    String escalationDeadline,
    String expiresAt,
    String resolution,
    boolean tiersExhausted,
    String createdAt,
    String updatedAt,
    List<EscalationLogPayload> escalations) {}
