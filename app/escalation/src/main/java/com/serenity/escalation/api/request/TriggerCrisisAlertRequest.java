/*
 * Where: crisis API request DTO
 * What: body of POST /v1/crisis/alerts
 * Why: kind and severity arrive as strings and are parsed by the service into enums
 */
package com.serenity.escalation.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is read once by the service")
public record TriggerCrisisAlertRequest(
    @NotBlank @Size(max = 64) String subjectUserId,
    @Size(max = 128) String subjectDisplayName,
    @NotBlank String kind,
    String severity,
    String message,
    @Size(max = 2000) String customMessage,
    Map<String, Object> location) {}
