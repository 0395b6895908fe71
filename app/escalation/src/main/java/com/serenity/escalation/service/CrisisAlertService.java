/*
 * Where: escalation service layer
 * What: API-facing facade: trigger, queries, responses, closing and delivery callbacks
 * Why: controllers and the receipt subscriber share validation and response mapping
 */
package com.serenity.escalation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serenity.escalation.api.AlertStateConflictException;
import com.serenity.escalation.api.CrisisAlertNotFoundException;
import com.serenity.escalation.api.InvalidCrisisRequestException;
import com.serenity.escalation.api.request.CloseAlertRequest;
import com.serenity.escalation.api.request.SubmitResponseRequest;
import com.serenity.escalation.api.request.TriggerCrisisAlertRequest;
import com.serenity.escalation.api.response.AlertClosureResponse;
import com.serenity.escalation.api.response.CrisisAlertResponse;
import com.serenity.escalation.api.response.DeliveryCallbackResponse;
import com.serenity.escalation.api.response.DeliveryStatusResponse;
import com.serenity.escalation.api.response.EscalationLogPayload;
import com.serenity.escalation.api.response.RecipientStatusPayload;
import com.serenity.escalation.api.response.ResponseSubmissionResponse;
import com.serenity.escalation.api.response.ResponseSummaryResponse;
import com.serenity.escalation.api.response.TriggerCrisisAlertResponse;
import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.DeliveryOutcome;
import com.serenity.escalation.model.DeliveryState;
import com.serenity.escalation.model.DeliveryStatusRecord;
import com.serenity.escalation.model.NotificationKind;
import com.serenity.escalation.model.NotificationRequestRecord;
import com.serenity.escalation.model.QueueItemRecord;
import com.serenity.escalation.model.RecipientRecord;
import com.serenity.escalation.model.ResponseSubmission;
import com.serenity.escalation.model.ResponseSummary;
import com.serenity.escalation.model.ResponseType;
import com.serenity.escalation.model.Severity;
import com.serenity.escalation.repository.CrisisAlertRepository;
import com.serenity.escalation.repository.NotificationRequestRepository;
import com.serenity.escalation.repository.RecipientRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CrisisAlertService {

  private static final Logger logger = LoggerFactory.getLogger(CrisisAlertService.class);

  static final String DEFAULT_RESOLUTION = "resolved";
  static final String DEFAULT_CANCEL_REASON = "cancelled";

  private final EscalationStateMachine stateMachine;
  private final ResponseCoordinator coordinator;
  private final DeliveryTracker tracker;
  private final NotificationQueue queue;
  private final NotificationRequestRepository requestRepository;
  private final CrisisAlertRepository alertRepository;
  private final RecipientRepository recipientRepository;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a Spring-managed shared component")
  private final ObjectMapper objectMapper;

  public CrisisAlertService(
      EscalationStateMachine stateMachine,
      ResponseCoordinator coordinator,
      DeliveryTracker tracker,
      NotificationQueue queue,
      NotificationRequestRepository requestRepository,
      CrisisAlertRepository alertRepository,
      RecipientRepository recipientRepository,
      Clock clock,
      ObjectMapper objectMapper) {
    this.stateMachine = stateMachine;
    this.coordinator = coordinator;
    this.tracker = tracker;
    this.queue = queue;
    this.requestRepository = requestRepository;
    this.alertRepository = alertRepository;
    this.recipientRepository = recipientRepository;
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  public TriggerCrisisAlertResponse trigger(TriggerCrisisAlertRequest request) {
    if (request == null) {
      throw new InvalidCrisisRequestException("request is required");
    }
    if (request.subjectUserId() == null || request.subjectUserId().isBlank()) {
      throw new InvalidCrisisRequestException("subject_user_id is required");
    }
    final NotificationKind kind = parseEnum(NotificationKind.class, request.kind(), "kind");
    final Severity severity =
        request.severity() == null || request.severity().isBlank()
            ? defaultSeverity(kind)
            : parseEnum(Severity.class, request.severity(), "severity");

    final NotificationRequestRecord record =
        new NotificationRequestRecord(
            UUID.randomUUID(),
            request.subjectUserId(),
            request.subjectDisplayName(),
            kind,
            request.message(),
            request.customMessage(),
            serializeLocation(request.location()),
            Instant.now(clock),
            null);
    final EscalationStateMachine.OpenedAlert opened = stateMachine.open(record, severity);
    final CrisisAlertRecord alert = opened.alert();
    return new TriggerCrisisAlertResponse(
        record.requestId().toString(),
        alert.crisisAlertId().toString(),
        alert.status().name(),
        severity.name(),
        alert.tier(),
        opened.recipients().size(),
        toIsoOrNull(alert.escalationDeadline()),
        CrisisResources.all());
  }

  public CrisisAlertResponse getAlert(UUID crisisAlertId) {
    final CrisisAlertRecord alert = requireAlert(crisisAlertId);
    final List<EscalationLogPayload> escalations =
        alertRepository.findEscalationLogs(crisisAlertId).stream()
            .map(
                log ->
                    new EscalationLogPayload(
                        log.previousTier(),
                        log.newTier(),
                        log.reason().value(),
                        toIsoOrNull(log.escalatedAt())))
            .toList();
    return new CrisisAlertResponse(
        alert.crisisAlertId().toString(),
        alert.requestId().toString(),
        alert.status().name(),
        alert.severity().name(),
        alert.tier(),
        alert.escalationLevel(),
        alert.responderCount(),
        alert.firstResponderId(),
        toIsoOrNull(alert.escalationDeadline()),
        toIsoOrNull(alert.expiresAt()),
        alert.resolution(),
        alert.tiersExhausted(),
        toIsoOrNull(alert.createdAt()),
        toIsoOrNull(alert.updatedAt()),
        escalations);
  }

  public DeliveryStatusResponse getStatus(UUID requestId) {
    final NotificationRequestRecord request =
        requestRepository
            .findById(requestId)
            .orElseThrow(() -> new CrisisAlertNotFoundException("notification request", requestId));
    final CrisisAlertRecord alert =
        alertRepository
            .findByRequestId(requestId)
            .orElseThrow(() -> new CrisisAlertNotFoundException("crisis alert for request", requestId));
    final Map<UUID, DeliveryStatusRecord> statuses = tracker.status(requestId);
    final Map<UUID, QueueItemRecord> latestItems =
        queue.findByCrisisAlertId(alert.crisisAlertId()).stream()
            .collect(
                Collectors.toMap(
                    QueueItemRecord::recipientId,
                    Function.identity(),
                    (first, second) -> second.seq() > first.seq() ? second : first,
                    LinkedHashMap::new));
    final List<RecipientStatusPayload> recipients =
        recipientRepository.findByRequestId(requestId).stream()
            .map(
                recipient ->
                    toRecipientPayload(
                        recipient,
                        statuses.get(recipient.recipientId()),
                        latestItems.get(recipient.recipientId())))
            .toList();
    return new DeliveryStatusResponse(
        requestId.toString(),
        alert.crisisAlertId().toString(),
        alert.status().name(),
        alert.tier(),
        tracker.hasTierReached(
            requestId, alert.tier(), EnumSet.of(DeliveryState.DELIVERED, DeliveryState.ACKNOWLEDGED)),
        toIsoOrNull(request.closedAt()),
        recipients);
  }

  public ResponseSubmissionResponse submitResponse(
      UUID crisisAlertId, SubmitResponseRequest request) {
    final ResponseType type =
        parseEnum(ResponseType.class, request.responseType(), "response_type");
    final ResponseSubmission submission =
        coordinator.submit(crisisAlertId, request.responderId(), type, request.notes());
    if (!submission.accepted() && "alert_not_found".equals(submission.reason())) {
      throw new CrisisAlertNotFoundException("crisis alert", crisisAlertId);
    }
    return new ResponseSubmissionResponse(
        crisisAlertId.toString(),
        submission.accepted(),
        submission.firstResponder(),
        submission.reason());
  }

  public ResponseSummaryResponse getResponseSummary(UUID crisisAlertId) {
    requireAlert(crisisAlertId);
    final ResponseSummary summary = coordinator.summarize(crisisAlertId);
    final Map<String, Long> counts = new LinkedHashMap<>();
    for (ResponseType type : ResponseType.values()) {
      counts.put(type.name(), summary.countsByType().getOrDefault(type, 0L));
    }
    return new ResponseSummaryResponse(
        crisisAlertId.toString(),
        summary.totalResponses(),
        counts,
        toIsoOrNull(summary.firstResponseAt()),
        toIsoOrNull(summary.lastResponseAt()));
  }

  public AlertClosureResponse resolve(UUID crisisAlertId, CloseAlertRequest request) {
    final CrisisAlertRecord alert = requireAlert(crisisAlertId);
    final String resolution = orDefault(request.resolution(), DEFAULT_RESOLUTION);
    if (!stateMachine.resolve(crisisAlertId, resolution, request.closedBy())) {
      throw new AlertStateConflictException(crisisAlertId, currentStatus(alert), "resolve");
    }
    return new AlertClosureResponse(
        crisisAlertId.toString(), CrisisAlertStatus.RESOLVED.name(), resolution);
  }

  public AlertClosureResponse cancel(UUID crisisAlertId, CloseAlertRequest request) {
    final CrisisAlertRecord alert = requireAlert(crisisAlertId);
    final String reason = orDefault(request.resolution(), DEFAULT_CANCEL_REASON);
    if (!stateMachine.cancel(crisisAlertId, reason, request.closedBy())) {
      throw new AlertStateConflictException(crisisAlertId, currentStatus(alert), "cancel");
    }
    return new AlertClosureResponse(
        crisisAlertId.toString(), CrisisAlertStatus.CANCELLED.name(), reason);
  }

  /**
   * Applies a transport receipt. A failure that advances the status is handed to the state
   * machine like a permanent send failure.
   */
  public DeliveryCallbackResponse recordDeliveryOutcome(
      UUID recipientId, DeliveryOutcome outcome, String connectionId, String reason) {
    final RecipientRecord recipient = recipientRepository.findById(recipientId).orElse(null);
    if (recipient == null) {
      logger.warn("delivery outcome for unknown recipient recipientId={}", recipientId);
      return new DeliveryCallbackResponse(recipientId.toString(), false);
    }
    final boolean advanced =
        switch (outcome) {
          case DELIVERED -> {
            final boolean recorded = tracker.recordDelivered(recipientId, connectionId);
            queue.markDelivered(recipientId);
            yield recorded;
          }
          case ACKNOWLEDGED -> tracker.recordAcknowledged(recipientId);
          case FAILED -> tracker.recordFailed(recipientId, orDefault(reason, "transport failure"));
        };
    if (advanced && outcome == DeliveryOutcome.FAILED) {
      alertRepository
          .findByRequestId(recipient.requestId())
          .ifPresent(alert -> stateMachine.onDeliveryFailed(alert.crisisAlertId(), recipient.tier()));
    }
    return new DeliveryCallbackResponse(recipientId.toString(), advanced);
  }

  public DeliveryCallbackResponse recordDeliveryOutcome(
      UUID recipientId, String outcome, String connectionId, String reason) {
    return recordDeliveryOutcome(
        recipientId, parseEnum(DeliveryOutcome.class, outcome, "outcome"), connectionId, reason);
  }

  private CrisisAlertRecord requireAlert(UUID crisisAlertId) {
    return alertRepository
        .findById(crisisAlertId)
        .orElseThrow(() -> new CrisisAlertNotFoundException("crisis alert", crisisAlertId));
  }

  private CrisisAlertStatus currentStatus(CrisisAlertRecord fallback) {
    return alertRepository
        .findById(fallback.crisisAlertId())
        .map(CrisisAlertRecord::status)
        .orElse(fallback.status());
  }

  private RecipientStatusPayload toRecipientPayload(
      RecipientRecord recipient, DeliveryStatusRecord status, QueueItemRecord item) {
    return new RecipientStatusPayload(
        recipient.recipientId().toString(),
        recipient.responderId(),
        recipient.tier(),
        recipient.channel().name(),
        status == null ? null : status.state().name(),
        item == null ? null : item.status().name(),
        item == null ? 0 : item.retryCount(),
        status == null ? null : toIsoOrNull(status.sentAt()),
        status == null ? null : toIsoOrNull(status.deliveredAt()),
        status == null ? null : toIsoOrNull(status.ackedAt()),
        status == null ? null : toIsoOrNull(status.failedAt()),
        status == null ? null : status.lastReason());
  }

  private String serializeLocation(Map<String, Object> location) {
    if (location == null || location.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(location);
    } catch (JsonProcessingException ex) {
      throw new InvalidCrisisRequestException("location must be a JSON object");
    }
  }

  private static Severity defaultSeverity(NotificationKind kind) {
    return kind == NotificationKind.CRISIS ? Severity.CRITICAL : Severity.LOW;
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidCrisisRequestException(field + " is required");
    }
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new InvalidCrisisRequestException("unsupported " + field + ": " + value);
    }
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private static String toIsoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
