package com.serenity.escalation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "response DTO is serialized once")
public record ResponseSummaryResponse(
    String crisisAlertId,
    long totalResponses,
    Map<String, Long> countsByType,
    String firstResponseAt,
    String lastResponseAt) {}
