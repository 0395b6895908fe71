/*
 * Where: crisis API
 * What: trigger, query, respond to and close crisis alerts; delivery callbacks; system health
 * Why: the patient app, supporter app and channel transports all enter through these endpoints
 */
package com.serenity.escalation.api;

import com.serenity.escalation.api.request.CloseAlertRequest;
import com.serenity.escalation.api.request.DeliveryCallbackRequest;
import com.serenity.escalation.api.request.SubmitResponseRequest;
import com.serenity.escalation.api.request.TriggerCrisisAlertRequest;
import com.serenity.escalation.api.response.AlertClosureResponse;
import com.serenity.escalation.api.response.CrisisAlertResponse;
import com.serenity.escalation.api.response.DeliveryCallbackResponse;
import com.serenity.escalation.api.response.DeliveryStatusResponse;
import com.serenity.escalation.api.response.ResponseSubmissionResponse;
import com.serenity.escalation.api.response.ResponseSummaryResponse;
import com.serenity.escalation.api.response.SystemHealthResponse;
import com.serenity.escalation.api.response.TriggerCrisisAlertResponse;
import com.serenity.escalation.model.SystemHealthSnapshot;
import com.serenity.escalation.service.CrisisAlertService;
import com.serenity.escalation.service.SystemHealthService;
import jakarta.validation.Valid;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/crisis")
@RequiredArgsConstructor
public class CrisisAlertController {

  private final CrisisAlertService crisisAlertService;
  private final SystemHealthService systemHealthService;

  @PostMapping("/alerts")
  public ResponseEntity<TriggerCrisisAlertResponse> trigger(
      @Valid @RequestBody TriggerCrisisAlertRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(crisisAlertService.trigger(request));
  }

  @GetMapping("/alerts/{crisisAlertId}")
  public ResponseEntity<CrisisAlertResponse> getAlert(
      @PathVariable("crisisAlertId") UUID crisisAlertId) {
    return ResponseEntity.ok(crisisAlertService.getAlert(crisisAlertId));
  }

  @GetMapping("/requests/{requestId}/status")
  public ResponseEntity<DeliveryStatusResponse> getStatus(
      @PathVariable("requestId") UUID requestId) {
    return ResponseEntity.ok(crisisAlertService.getStatus(requestId));
  }

  @PostMapping("/alerts/{crisisAlertId}/responses")
  public ResponseEntity<ResponseSubmissionResponse> submitResponse(
      @PathVariable("crisisAlertId") UUID crisisAlertId,
      @Valid @RequestBody SubmitResponseRequest request) {
    return ResponseEntity.ok(crisisAlertService.submitResponse(crisisAlertId, request));
  }

  @GetMapping("/alerts/{crisisAlertId}/responses/summary")
  public ResponseEntity<ResponseSummaryResponse> getResponseSummary(
      @PathVariable("crisisAlertId") UUID crisisAlertId) {
    return ResponseEntity.ok(crisisAlertService.getResponseSummary(crisisAlertId));
  }

  @PostMapping("/alerts/{crisisAlertId}/resolve")
  public ResponseEntity<AlertClosureResponse> resolve(
      @PathVariable("crisisAlertId") UUID crisisAlertId,
      @Valid @RequestBody CloseAlertRequest request) {
    return ResponseEntity.ok(crisisAlertService.resolve(crisisAlertId, request));
  }

  @PostMapping("/alerts/{crisisAlertId}/cancel")
  public ResponseEntity<AlertClosureResponse> cancel(
      @PathVariable("crisisAlertId") UUID crisisAlertId,
      @Valid @RequestBody CloseAlertRequest request) {
    return ResponseEntity.ok(crisisAlertService.cancel(crisisAlertId, request));
  }

  @PostMapping("/deliveries/callback")
  public ResponseEntity<DeliveryCallbackResponse> deliveryCallback(
      @Valid @RequestBody DeliveryCallbackRequest request) {
    return ResponseEntity.ok(
        crisisAlertService.recordDeliveryOutcome(
            request.recipientId(), request.outcome(), request.connectionId(), request.reason()));
  }

  @GetMapping("/system/health")
  public ResponseEntity<SystemHealthResponse> systemHealth() {
    final SystemHealthSnapshot snapshot = systemHealthService.snapshot();
    return ResponseEntity.ok(
        new SystemHealthResponse(
            snapshot.status().name().toLowerCase(Locale.ROOT),
            snapshot.queuedCount(),
            snapshot.failedCount(),
            snapshot.activeCrises(),
            snapshot.averageResponseSeconds(),
            snapshot.checkedAt().toString()));
  }
}
