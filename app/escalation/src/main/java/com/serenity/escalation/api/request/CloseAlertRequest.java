package com.serenity.escalation.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of the resolve and cancel endpoints. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CloseAlertRequest(
    @Size(max = 64) String resolution, @NotBlank @Size(max = 64) String closedBy) {}
