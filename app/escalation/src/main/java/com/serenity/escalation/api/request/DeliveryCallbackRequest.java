package com.serenity.escalation.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/** Transport callback reporting what happened to one recipient's notification. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryCallbackRequest(
    @NotNull UUID recipientId, @NotBlank String outcome, String connectionId, String reason) {}
