package com.serenity.escalation.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitResponseRequest(
    @NotBlank @Size(max = 64) String responderId,
    @NotBlank String responseType,
    @Size(max = 2000) String notes) {}
