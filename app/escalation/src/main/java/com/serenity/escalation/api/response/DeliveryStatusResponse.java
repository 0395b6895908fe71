package com.serenity.escalation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "response DTO is serialized once")
public record DeliveryStatusResponse(
    String requestId,
    String crisisAlertId,
    String alertStatus,
    int tier,
    boolean currentTierReached,
    String closedAt,
    List<RecipientStatusPayload> recipients) {}
