/*
 * Where: crisis API response DTO
 * What: result of a trigger, with the crisis lines shown to the person in crisis
 * Why: the caller needs both ids to follow the alert and the request's delivery status
 */
package com.serenity.escalation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.serenity.escalation.model.CrisisResource;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "response DTO is serialized once")
public record TriggerCrisisAlertResponse(
    String requestId,
    String crisisAlertId,
    String status,
    String severity,
    int tier,
    int recipientCount,
    String escalationDeadline,
    List<CrisisResource> resources) {}
