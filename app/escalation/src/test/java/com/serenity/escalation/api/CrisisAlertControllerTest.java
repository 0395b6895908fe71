package com.serenity.escalation.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.serenity.escalation.api.request.CloseAlertRequest;
import com.serenity.escalation.api.request.SubmitResponseRequest;
import com.serenity.escalation.api.request.TriggerCrisisAlertRequest;
import com.serenity.escalation.api.response.DeliveryCallbackResponse;
import com.serenity.escalation.api.response.ResponseSubmissionResponse;
import com.serenity.escalation.api.response.TriggerCrisisAlertResponse;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.CrisisResource;
import com.serenity.escalation.model.HealthStatus;
import com.serenity.escalation.model.SystemHealthSnapshot;
import com.serenity.escalation.service.CrisisAlertService;
import com.serenity.escalation.service.SystemHealthService;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CrisisAlertController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class CrisisAlertControllerTest {

  private static final UUID ALERT_ID = UUID.fromString("6f1c2a4e-0b7d-4c55-9a57-7f2d1e3b9c10");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CrisisAlertService crisisAlertService;
  @MockitoBean private SystemHealthService systemHealthService;

  @Test
  void triggerReturns201WithResources() throws Exception {
    when(crisisAlertService.trigger(any(TriggerCrisisAlertRequest.class)))
        .thenReturn(
            new TriggerCrisisAlertResponse(
                "req-1",
                ALERT_ID.toString(),
                "SENT",
                "CRITICAL",
                1,
                2,
                "2026-01-17T00:00:30Z",
                List.of(new CrisisResource("988 Suicide & Crisis Lifeline", "988", "24/7"))));

    mockMvc
        .perform(
            post("/v1/crisis/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"subject_user_id":"user-7","kind":"CRISIS","severity":"CRITICAL"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.crisis_alert_id").value(ALERT_ID.toString()))
        .andExpect(jsonPath("$.recipient_count").value(2))
        .andExpect(jsonPath("$.resources[0].contact").value("988"));
  }

  @Test
  void triggerWithoutSubjectIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/v1/crisis/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"kind":"CRISIS"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CRISIS_VALIDATION_ERROR"));
  }

  @Test
  void unknownKindMapsTo400() throws Exception {
    when(crisisAlertService.trigger(any(TriggerCrisisAlertRequest.class)))
        .thenThrow(new InvalidCrisisRequestException("unknown kind: PANIC"));

    mockMvc
        .perform(
            post("/v1/crisis/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"subject_user_id":"user-7","kind":"PANIC"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CRISIS_BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("unknown kind: PANIC"));
  }

  @Test
  void missingAlertMapsTo404() throws Exception {
    when(crisisAlertService.getAlert(ALERT_ID))
        .thenThrow(new CrisisAlertNotFoundException("crisis alert", ALERT_ID));

    mockMvc
        .perform(get("/v1/crisis/alerts/" + ALERT_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CRISIS_NOT_FOUND"));
  }

  @Test
  void malformedAlertIdMapsTo400() throws Exception {
    mockMvc
        .perform(get("/v1/crisis/alerts/not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("CRISIS_BAD_REQUEST"));
  }

  @Test
  void responseIsForwardedToService() throws Exception {
    when(crisisAlertService.submitResponse(eq(ALERT_ID), any(SubmitResponseRequest.class)))
        .thenReturn(new ResponseSubmissionResponse(ALERT_ID.toString(), true, true, null));

    mockMvc
        .perform(
            post("/v1/crisis/alerts/" + ALERT_ID + "/responses")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"responder_id":"sup-a","response_type":"ACKNOWLEDGED"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accepted").value(true))
        .andExpect(jsonPath("$.first_responder").value(true));
  }

  @Test
  void cancelAfterAcknowledgeMapsTo409() throws Exception {
    when(crisisAlertService.cancel(eq(ALERT_ID), any(CloseAlertRequest.class)))
        .thenThrow(
            new AlertStateConflictException(ALERT_ID, CrisisAlertStatus.ACKNOWLEDGED, "cancel"));

    mockMvc
        .perform(
            post("/v1/crisis/alerts/" + ALERT_ID + "/cancel")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"closed_by":"user-7"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CRISIS_STATE_CONFLICT"));
  }

  @Test
  void deliveryCallbackReportsWhetherStatusAdvanced() throws Exception {
    final UUID recipientId = UUID.randomUUID();
    when(crisisAlertService.recordDeliveryOutcome(recipientId, "DELIVERED", "conn-1", null))
        .thenReturn(new DeliveryCallbackResponse(recipientId.toString(), false));

    mockMvc
        .perform(
            post("/v1/crisis/deliveries/callback")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"recipient_id":"%s","outcome":"DELIVERED","connection_id":"conn-1"}
                    """
                        .formatted(recipientId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accepted").value(false));
  }

  @Test
  void unexpectedErrorHidesDetails() throws Exception {
    when(crisisAlertService.getAlert(ALERT_ID))
        .thenThrow(new IllegalStateException("connection refused: db-1:5432"));

    mockMvc
        .perform(get("/v1/crisis/alerts/" + ALERT_ID))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("CRISIS_INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }

  @Test
  void systemHealthUsesLowercaseStatus() throws Exception {
    when(systemHealthService.snapshot())
        .thenReturn(
            new SystemHealthSnapshot(
                HealthStatus.WARNING, 120, 2, 4, null, Instant.parse("2026-01-17T00:00:00Z")));

    mockMvc
        .perform(get("/v1/crisis/system/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("warning"))
        .andExpect(jsonPath("$.queued_count").value(120))
        .andExpect(jsonPath("$.active_crises").value(4));
  }
}
