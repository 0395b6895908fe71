/*
 * Where: escalation service layer
 * What: crisis alert lifecycle: open, tier escalation on deadline or delivery failure, close
 * Why: all writes to one alert are serialized here so tiers, deadlines and events stay consistent
 */
package com.serenity.escalation.service;

import com.serenity.escalation.config.EscalationProperties;
import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.CrisisEventType;
import com.serenity.escalation.model.CrisisLifecycleEvent;
import com.serenity.escalation.model.EscalationLogRecord;
import com.serenity.escalation.model.EscalationReason;
import com.serenity.escalation.model.NotificationRequestRecord;
import com.serenity.escalation.model.RecipientRecord;
import com.serenity.escalation.model.Severity;
import com.serenity.escalation.model.TieredResponder;
import com.serenity.escalation.repository.CrisisAlertRepository;
import com.serenity.escalation.repository.NotificationRequestRepository;
import com.serenity.escalation.repository.RecipientRepository;
import com.serenity.escalation.repository.SupporterResponseRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class EscalationStateMachine {

  private static final Logger logger = LoggerFactory.getLogger(EscalationStateMachine.class);

  static final String RESOLUTION_EXPIRED = "expired";
  private static final String SYSTEM_ACTOR = "system";
  private static final int SWEEP_LIMIT = 500;

  private final NotificationRequestRepository requestRepository;
  private final RecipientRepository recipientRepository;
  private final CrisisAlertRepository alertRepository;
  private final SupporterResponseRepository responseRepository;
  private final RecipientDirectory directory;
  private final NotificationQueue queue;
  private final DeliveryTracker tracker;
  private final EscalationTimers timers;
  private final CrisisAlertLocks locks;
  private final CrisisEventSink events;
  private final EscalationProperties properties;
  private final EscalationMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public EscalationStateMachine(
      NotificationRequestRepository requestRepository,
      RecipientRepository recipientRepository,
      CrisisAlertRepository alertRepository,
      SupporterResponseRepository responseRepository,
      RecipientDirectory directory,
      NotificationQueue queue,
      DeliveryTracker tracker,
      EscalationTimers timers,
      CrisisAlertLocks locks,
      CrisisEventSink events,
      EscalationProperties properties,
      EscalationMetrics metrics,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.requestRepository = requestRepository;
    this.recipientRepository = recipientRepository;
    this.alertRepository = alertRepository;
    this.responseRepository = responseRepository;
    this.directory = directory;
    this.queue = queue;
    this.tracker = tracker;
    this.timers = timers;
    this.locks = locks;
    this.events = events;
    this.properties = properties;
    this.metrics = metrics;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /**
   * Stores the request, opens its alert on tier 1 and queues the tier 1 recipients.
   *
   * <p>A directory failure or an empty support network still opens the alert; it stays
   * SCHEDULED without queue items and an {@code alert.no_recipients} event is emitted.
   */
  public OpenedAlert open(NotificationRequestRecord request, Severity severity) {
    final Instant now = Instant.now(clock);
    final List<TieredResponder> tierOne =
        resolveTiers(request).stream().filter(responder -> responder.tier() == 1).toList();
    final CrisisAlertRecord alert =
        CrisisAlertRecord.builder()
            .crisisAlertId(UUID.randomUUID())
            .requestId(request.requestId())
            .severity(severity)
            .status(CrisisAlertStatus.SCHEDULED)
            .tier(1)
            .responderCount(0)
            .escalationLevel(0)
            .escalationDeadline(now.plus(properties.window(severity, 1)))
            .expiresAt(now.plus(properties.maxLifetime()))
            .tiersExhausted(false)
            .createdAt(now)
            .updatedAt(now)
            .build();

    final List<RecipientRecord> recipients =
        transactionTemplate.execute(
            status -> {
              requestRepository.insert(request);
              alertRepository.insert(alert);
              final List<RecipientRecord> written = addRecipients(alert, tierOne, now);
              emit(
                  CrisisEventType.ALERT_CREATED,
                  alert,
                  request,
                  alert.tier(),
                  Map.of(
                      "kind", request.kind().name(),
                      "recipient_count", String.valueOf(written.size())),
                  now);
              if (written.isEmpty()) {
                emit(CrisisEventType.ALERT_NO_RECIPIENTS, alert, request, alert.tier(), Map.of(), now);
              }
              return written;
            });

    metrics.recordAlertCreated(severity);
    if (recipients.isEmpty()) {
      metrics.recordNoRecipients();
      logger.error(
          "crisis alert opened without recipients crisisAlertId={} requestId={} subjectUserId={}",
          alert.crisisAlertId(),
          request.requestId(),
          request.subjectUserId());
    } else {
      logger.info(
          "crisis alert opened crisisAlertId={} requestId={} severity={} recipients={}",
          alert.crisisAlertId(),
          request.requestId(),
          severity,
          recipients.size());
    }
    armDeadline(alert.crisisAlertId(), alert.escalationDeadline());
    return new OpenedAlert(alert, recipients);
  }

  /** Timer and sweep entry point: escalates, expires or re-arms the alert. */
  public void evaluate(UUID crisisAlertId) {
    locks.withLock(crisisAlertId, () -> evaluateLocked(crisisAlertId));
  }

  /** A send succeeded; tier 1 moves the alert from SCHEDULED to SENT. */
  public void onDeliverySucceeded(UUID crisisAlertId, int tier) {
    locks.withLock(
        crisisAlertId,
        () -> {
          final CrisisAlertRecord alert = alertRepository.findById(crisisAlertId).orElse(null);
          if (alert == null || alert.status() != CrisisAlertStatus.SCHEDULED || tier != 1) {
            return;
          }
          alertRepository.transition(
              crisisAlertId,
              EnumSet.of(CrisisAlertStatus.SCHEDULED),
              CrisisAlertStatus.SENT,
              Instant.now(clock));
        });
  }

  /**
   * A recipient failed permanently. Escalates ahead of the deadline when every recipient of the
   * current tier has failed and nobody engaged.
   */
  public void onDeliveryFailed(UUID crisisAlertId, int tier) {
    locks.withLock(crisisAlertId, () -> escalateIfTierFailed(crisisAlertId, tier));
  }

  /** A recipient's retries ran out. */
  public void onDeliveryExhausted(UUID crisisAlertId, UUID recipientId, int tier) {
    locks.withLock(
        crisisAlertId,
        () -> {
          final CrisisAlertRecord alert = alertRepository.findById(crisisAlertId).orElse(null);
          if (alert == null) {
            return;
          }
          final NotificationRequestRecord request =
              requestRepository.findById(alert.requestId()).orElse(null);
          transactionTemplate.executeWithoutResult(
              status ->
                  emit(
                      CrisisEventType.DELIVERY_EXHAUSTED,
                      alert,
                      request,
                      tier,
                      Map.of("recipient_id", recipientId.toString()),
                      Instant.now(clock)));
          escalateIfTierFailed(crisisAlertId, tier);
        });
  }

  /** Stops escalation after an engaging response. Returns false when the alert cannot move. */
  public boolean acknowledge(UUID crisisAlertId, String responderId) {
    return locks.withLock(
        crisisAlertId,
        () -> {
          final CrisisAlertRecord alert = alertRepository.findById(crisisAlertId).orElse(null);
          if (alert == null) {
            return false;
          }
          if (alert.status() == CrisisAlertStatus.ACKNOWLEDGED) {
            return true;
          }
          if (!alert.status().canTransitionTo(CrisisAlertStatus.ACKNOWLEDGED)) {
            logger.warn(
                "illegal alert transition crisisAlertId={} from={} to={}",
                crisisAlertId,
                alert.status(),
                CrisisAlertStatus.ACKNOWLEDGED);
            return false;
          }
          final Instant now = Instant.now(clock);
          final Boolean moved =
              transactionTemplate.execute(
                  status -> {
                    final int updated =
                        alertRepository.transition(
                            crisisAlertId,
                            CrisisAlertStatus.ESCALATING,
                            CrisisAlertStatus.ACKNOWLEDGED,
                            now);
                    if (updated == 0) {
                      return false;
                    }
                    alertRepository.updateDeadline(crisisAlertId, null, now);
                    emit(
                        CrisisEventType.ALERT_ACKNOWLEDGED,
                        alert,
                        requestRepository.findById(alert.requestId()).orElse(null),
                        alert.tier(),
                        Map.of("responder_id", responderId),
                        now);
                    return true;
                  });
          if (!Boolean.TRUE.equals(moved)) {
            return false;
          }
          // escalation stops; only the max-lifetime expiry stays armed
          armDeadline(crisisAlertId, alert.expiresAt());
          metrics.recordAcknowledged();
          logger.info(
              "crisis alert acknowledged crisisAlertId={} responderId={} tier={}",
              crisisAlertId,
              responderId,
              alert.tier());
          return true;
        });
  }

  /** Closes an open alert as RESOLVED. Returns false when the alert is unknown or already closed. */
  public boolean resolve(UUID crisisAlertId, String resolution, String closedBy) {
    return locks.withLock(
        crisisAlertId,
        () -> {
          final CrisisAlertRecord alert = alertRepository.findById(crisisAlertId).orElse(null);
          if (alert == null) {
            return false;
          }
          if (!alert.status().canTransitionTo(CrisisAlertStatus.RESOLVED)) {
            logger.warn(
                "illegal alert transition crisisAlertId={} from={} to={}",
                crisisAlertId,
                alert.status(),
                CrisisAlertStatus.RESOLVED);
            return false;
          }
          return close(alert, CrisisAlertStatus.OPEN, CrisisAlertStatus.RESOLVED, resolution, closedBy);
        });
  }

  /** Cancels an alert nobody acknowledged yet. */
  public boolean cancel(UUID crisisAlertId, String reason, String cancelledBy) {
    return locks.withLock(
        crisisAlertId,
        () -> {
          final CrisisAlertRecord alert = alertRepository.findById(crisisAlertId).orElse(null);
          if (alert == null) {
            return false;
          }
          if (!alert.status().canTransitionTo(CrisisAlertStatus.CANCELLED)) {
            logger.warn(
                "illegal alert transition crisisAlertId={} from={} to={}",
                crisisAlertId,
                alert.status(),
                CrisisAlertStatus.CANCELLED);
            return false;
          }
          return close(
              alert, CrisisAlertStatus.ESCALATING, CrisisAlertStatus.CANCELLED, reason, cancelledBy);
        });
  }

  /**
   * Safety net for lost timers: evaluates overdue alerts and re-arms the others.
   *
   * @return number of alerts evaluated
   */
  public int sweep() {
    final Instant now = Instant.now(clock);
    int evaluated = 0;
    for (CrisisAlertRecord alert : alertRepository.findOpen(SWEEP_LIMIT)) {
      final Instant fireAt = nextFireAt(alert);
      if (!now.isBefore(fireAt)) {
        try {
          evaluate(alert.crisisAlertId());
          evaluated++;
        } catch (RuntimeException ex) {
          logger.error("sweep evaluation failed crisisAlertId={}", alert.crisisAlertId(), ex);
        }
      } else if (!timers.isArmed(alert.crisisAlertId())) {
        armDeadline(alert.crisisAlertId(), fireAt);
      }
    }
    return evaluated;
  }

  private void evaluateLocked(UUID crisisAlertId) {
    final CrisisAlertRecord alert = alertRepository.findById(crisisAlertId).orElse(null);
    if (alert == null || !CrisisAlertStatus.OPEN.contains(alert.status())) {
      timers.disarm(crisisAlertId);
      return;
    }
    final Instant now = Instant.now(clock);
    if (!now.isBefore(alert.expiresAt())) {
      logger.warn(
          "crisis alert reached max lifetime crisisAlertId={} status={} tier={}",
          crisisAlertId,
          alert.status(),
          alert.tier());
      close(
          alert,
          CrisisAlertStatus.OPEN,
          CrisisAlertStatus.RESOLVED,
          RESOLUTION_EXPIRED,
          SYSTEM_ACTOR);
      return;
    }
    if (alert.status() == CrisisAlertStatus.ACKNOWLEDGED) {
      armDeadline(crisisAlertId, alert.expiresAt());
      return;
    }
    if (alert.escalationDeadline() != null && now.isBefore(alert.escalationDeadline())) {
      armDeadline(crisisAlertId, alert.escalationDeadline());
      return;
    }
    if (responseRepository.existsActiveEngaging(crisisAlertId)) {
      return;
    }
    if (alert.tiersExhausted()) {
      armDeadline(crisisAlertId, alert.expiresAt());
      return;
    }
    escalate(alert, EscalationReason.TIMEOUT, now);
  }

  private void escalateIfTierFailed(UUID crisisAlertId, int tier) {
    final CrisisAlertRecord alert = alertRepository.findById(crisisAlertId).orElse(null);
    if (alert == null
        || !CrisisAlertStatus.ESCALATING.contains(alert.status())
        || alert.tier() != tier
        || alert.tiersExhausted()) {
      return;
    }
    if (!tracker.allTierRecipientsFailed(alert.requestId(), tier)) {
      return;
    }
    if (responseRepository.existsActiveEngaging(crisisAlertId)) {
      return;
    }
    escalate(alert, EscalationReason.DELIVERY_FAILED, Instant.now(clock));
  }

  private void escalate(CrisisAlertRecord alert, EscalationReason reason, Instant now) {
    final NotificationRequestRecord request =
        requestRepository.findById(alert.requestId()).orElse(null);
    if (request == null) {
      logger.error(
          "crisis alert has no request crisisAlertId={} requestId={}",
          alert.crisisAlertId(),
          alert.requestId());
      return;
    }
    final int nextTier = alert.tier() + 1;
    final List<TieredResponder> responders =
        resolveTiers(request).stream().filter(responder -> responder.tier() == nextTier).toList();
    if (responders.isEmpty()) {
      exhaustTiers(alert, request, now);
      return;
    }

    final Instant deadline = now.plus(properties.window(alert.severity(), nextTier));
    final List<RecipientRecord> written =
        transactionTemplate.execute(
            status -> {
              final int updated =
                  alertRepository.escalate(
                      alert.crisisAlertId(), alert.tier(), nextTier, deadline, now);
              if (updated == 0) {
                return null;
              }
              alertRepository.insertEscalationLog(
                  new EscalationLogRecord(
                      UUID.randomUUID(), alert.crisisAlertId(), alert.tier(), nextTier, reason, now));
              final CrisisAlertRecord escalated =
                  alert.toBuilder()
                      .status(CrisisAlertStatus.ESCALATED)
                      .tier(nextTier)
                      .escalationLevel(alert.escalationLevel() + 1)
                      .escalationDeadline(deadline)
                      .build();
              final List<RecipientRecord> recipients = addRecipients(escalated, responders, now);
              emit(
                  CrisisEventType.TIER_ESCALATED,
                  escalated,
                  request,
                  nextTier,
                  Map.of(
                      "previous_tier", String.valueOf(alert.tier()),
                      "new_tier", String.valueOf(nextTier),
                      "reason", reason.value(),
                      "recipient_count", String.valueOf(recipients.size())),
                  now);
              return recipients;
            });
    if (written == null) {
      logger.warn(
          "crisis alert changed during escalation crisisAlertId={} expectedTier={}",
          alert.crisisAlertId(),
          alert.tier());
      return;
    }
    metrics.recordEscalation(reason);
    logger.info(
        "crisis alert escalated crisisAlertId={} tier={}->{} reason={} recipients={}",
        alert.crisisAlertId(),
        alert.tier(),
        nextTier,
        reason.value(),
        written.size());
    armDeadline(alert.crisisAlertId(), deadline);
  }

  private void exhaustTiers(CrisisAlertRecord alert, NotificationRequestRecord request, Instant now) {
    final Boolean flagged =
        transactionTemplate.execute(
            status -> {
              if (alertRepository.markTiersExhausted(alert.crisisAlertId(), now) == 0) {
                return false;
              }
              alertRepository.updateDeadline(alert.crisisAlertId(), alert.expiresAt(), now);
              emit(
                  CrisisEventType.ALERT_TIERS_EXHAUSTED,
                  alert,
                  request,
                  alert.tier(),
                  Map.of("last_tier", String.valueOf(alert.tier())),
                  now);
              return true;
            });
    if (Boolean.TRUE.equals(flagged)) {
      metrics.recordTiersExhausted();
      logger.warn(
          "crisis alert has no further tiers crisisAlertId={} tier={} expiresAt={}",
          alert.crisisAlertId(),
          alert.tier(),
          alert.expiresAt());
    }
    armDeadline(alert.crisisAlertId(), alert.expiresAt());
  }

  private boolean close(
      CrisisAlertRecord alert,
      Set<CrisisAlertStatus> from,
      CrisisAlertStatus target,
      String resolution,
      String actor) {
    final Instant now = Instant.now(clock);
    final Integer cancelledItems =
        transactionTemplate.execute(
            status -> {
              final int updated =
                  alertRepository.close(alert.crisisAlertId(), from, target, resolution, now);
              if (updated == 0) {
                return null;
              }
              final int cancelled =
                  queue.cancelOutstanding(alert.crisisAlertId(), "alert " + target.name());
              requestRepository.markClosed(alert.requestId(), now);
              emit(
                  target == CrisisAlertStatus.CANCELLED
                      ? CrisisEventType.ALERT_CANCELLED
                      : CrisisEventType.ALERT_RESOLVED,
                  alert,
                  requestRepository.findById(alert.requestId()).orElse(null),
                  alert.tier(),
                  Map.of(
                      "resolution", resolution == null ? "" : resolution,
                      "closed_by", actor == null ? SYSTEM_ACTOR : actor,
                      "cancelled_items", String.valueOf(cancelled)),
                  now);
              return cancelled;
            });
    if (cancelledItems == null) {
      logger.warn(
          "crisis alert close lost a race crisisAlertId={} target={}",
          alert.crisisAlertId(),
          target);
      return false;
    }
    timers.disarm(alert.crisisAlertId());
    metrics.recordClosed(target, resolution);
    logger.info(
        "crisis alert closed crisisAlertId={} status={} resolution={} cancelledItems={}",
        alert.crisisAlertId(),
        target,
        resolution,
        cancelledItems);
    return true;
  }

  private List<RecipientRecord> addRecipients(
      CrisisAlertRecord alert, List<TieredResponder> responders, Instant now) {
    final List<RecipientRecord> written = new ArrayList<>();
    for (TieredResponder responder : responders) {
      final RecipientRecord recipient =
          new RecipientRecord(
              UUID.randomUUID(),
              alert.requestId(),
              responder.responderId(),
              responder.responderRole(),
              responder.tier(),
              responder.channel(),
              responder.priorityOrder(),
              now,
              now);
      // a responder already notified on an earlier tier is not queued twice
      if (!recipientRepository.insertIfAbsent(recipient)) {
        continue;
      }
      queue.enqueue(alert, recipient, now);
      written.add(recipient);
    }
    return written;
  }

  private List<TieredResponder> resolveTiers(NotificationRequestRecord request) {
    try {
      return directory.resolveTiers(request.subjectUserId(), request.kind());
    } catch (RuntimeException ex) {
      logger.error(
          "support network lookup failed subjectUserId={} requestId={}",
          request.subjectUserId(),
          request.requestId(),
          ex);
      return List.of();
    }
  }

  private void emit(
      CrisisEventType type,
      CrisisAlertRecord alert,
      NotificationRequestRecord request,
      int tier,
      Map<String, String> attributes,
      Instant now) {
    events.emit(
        new CrisisLifecycleEvent(
            UUID.randomUUID(),
            type,
            alert.crisisAlertId(),
            alert.requestId(),
            request == null ? null : request.subjectUserId(),
            alert.severity(),
            tier,
            now,
            attributes));
  }

  private static Instant nextFireAt(CrisisAlertRecord alert) {
    if (alert.status() == CrisisAlertStatus.ACKNOWLEDGED || alert.escalationDeadline() == null) {
      return alert.expiresAt();
    }
    return alert.escalationDeadline().isBefore(alert.expiresAt())
        ? alert.escalationDeadline()
        : alert.expiresAt();
  }

  private void armDeadline(UUID crisisAlertId, Instant fireAt) {
    timers.arm(crisisAlertId, fireAt, () -> evaluate(crisisAlertId));
  }

  /** Alert opened by {@link #open} together with the recipients queued for tier 1. */
  public record OpenedAlert(CrisisAlertRecord alert, List<RecipientRecord> recipients) {

    public OpenedAlert {
      recipients = List.copyOf(recipients);
    }
  }
}
