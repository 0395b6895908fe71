/*
 * Where: escalation service layer
 * What: records supporter responses and elects exactly one first responder per alert
 * Why: concurrent responders race; the per-alert lock plus the conditional claim keep one winner
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.CoordinationStatus;
import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.CrisisEventType;
import com.serenity.escalation.model.CrisisLifecycleEvent;
import com.serenity.escalation.model.NotificationRequestRecord;
import com.serenity.escalation.model.ResponseSubmission;
import com.serenity.escalation.model.ResponseSummary;
import com.serenity.escalation.model.ResponseType;
import com.serenity.escalation.model.SupporterResponseRecord;
import com.serenity.escalation.repository.CrisisAlertRepository;
import com.serenity.escalation.repository.NotificationRequestRepository;
import com.serenity.escalation.repository.RecipientRepository;
import com.serenity.escalation.repository.SupporterResponseRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class ResponseCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(ResponseCoordinator.class);

  static final String RESOLUTION_EMERGENCY_SERVICES = "emergency_services";

  private final CrisisAlertRepository alertRepository;
  private final SupporterResponseRepository responseRepository;
  private final RecipientRepository recipientRepository;
  private final NotificationRequestRepository requestRepository;
  private final DeliveryTracker tracker;
  private final EscalationStateMachine stateMachine;
  private final CrisisAlertLocks locks;
  private final CrisisEventSink events;
  private final EscalationMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public ResponseCoordinator(
      CrisisAlertRepository alertRepository,
      SupporterResponseRepository responseRepository,
      RecipientRepository recipientRepository,
      NotificationRequestRepository requestRepository,
      DeliveryTracker tracker,
      EscalationStateMachine stateMachine,
      CrisisAlertLocks locks,
      CrisisEventSink events,
      EscalationMetrics metrics,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.alertRepository = alertRepository;
    this.responseRepository = responseRepository;
    this.recipientRepository = recipientRepository;
    this.requestRepository = requestRepository;
    this.tracker = tracker;
    this.stateMachine = stateMachine;
    this.locks = locks;
    this.events = events;
    this.metrics = metrics;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /**
   * Records a response. A replay of the responder's active response type is a no-op; a different
   * type supersedes it. Engaging responses stop escalation and {@link ResponseType#CALL_911}
   * resolves the alert.
   */
  public ResponseSubmission submit(
      UUID crisisAlertId, String responderId, ResponseType type, String notes) {
    return locks.withLock(
        crisisAlertId, () -> submitLocked(crisisAlertId, responderId, type, notes));
  }

  public ResponseSummary summarize(UUID crisisAlertId) {
    return responseRepository.summarize(crisisAlertId);
  }

  private ResponseSubmission submitLocked(
      UUID crisisAlertId, String responderId, ResponseType type, String notes) {
    final CrisisAlertRecord alert = alertRepository.findById(crisisAlertId).orElse(null);
    if (alert == null) {
      return ResponseSubmission.rejected("alert_not_found");
    }
    if (alert.status().isTerminal()) {
      logger.info(
          "response rejected on closed alert crisisAlertId={} responderId={} status={}",
          crisisAlertId,
          responderId,
          alert.status());
      return ResponseSubmission.rejected("alert_closed");
    }
    final SupporterResponseRecord active =
        responseRepository.findActive(crisisAlertId, responderId).orElse(null);
    if (active != null && active.responseType() == type) {
      return ResponseSubmission.duplicate();
    }

    final Instant now = Instant.now(clock);
    final boolean firstResponder =
        Boolean.TRUE.equals(
            transactionTemplate.execute(
                status -> {
                  if (active != null) {
                    responseRepository.supersede(active.responseId());
                  }
                  boolean claimed = false;
                  if (type.engaging()) {
                    claimed = alertRepository.claimFirstResponder(crisisAlertId, responderId, now) == 1;
                    if (!responseRepository.hasEngaged(crisisAlertId, responderId)) {
                      alertRepository.incrementResponderCount(crisisAlertId, now);
                    }
                  }
                  responseRepository.insert(
                      new SupporterResponseRecord(
                          UUID.randomUUID(),
                          crisisAlertId,
                          responderId,
                          type,
                          notes,
                          now,
                          CoordinationStatus.ACTIVE,
                          claimed));
                  final Map<String, String> attributes = new HashMap<>();
                  attributes.put("responder_id", responderId);
                  attributes.put("response_type", type.name());
                  attributes.put("first_responder", String.valueOf(claimed));
                  final NotificationRequestRecord request =
                      requestRepository.findById(alert.requestId()).orElse(null);
                  events.emit(
                      new CrisisLifecycleEvent(
                          UUID.randomUUID(),
                          CrisisEventType.RESPONSE_RECORDED,
                          crisisAlertId,
                          alert.requestId(),
                          request == null ? null : request.subjectUserId(),
                          alert.severity(),
                          alert.tier(),
                          now,
                          attributes));
                  return claimed;
                }));

    if (type.engaging()) {
      recipientRepository
          .findByRequestAndResponder(alert.requestId(), responderId)
          .ifPresent(recipient -> tracker.recordAcknowledged(recipient.recipientId()));
    }
    metrics.recordResponse(type, firstResponder);
    if (firstResponder) {
      metrics.recordFirstResponseDelay(alert.createdAt(), now);
      logger.info(
          "first responder elected crisisAlertId={} responderId={} type={}",
          crisisAlertId,
          responderId,
          type);
    }

    if (type.engaging() && CrisisAlertStatus.ESCALATING.contains(alert.status())) {
      stateMachine.acknowledge(crisisAlertId, responderId);
    }
    if (type == ResponseType.CALL_911) {
      stateMachine.resolve(crisisAlertId, RESOLUTION_EMERGENCY_SERVICES, responderId);
    }
    return ResponseSubmission.recorded(firstResponder);
  }
}
