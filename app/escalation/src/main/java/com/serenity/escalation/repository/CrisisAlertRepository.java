/*
 * Where: escalation data access
 * What: persistence contract for crisis_alerts and crisis_escalation_logs
 * Why: every status write is conditional so that concurrent writers cannot move an alert backwards
 */
package com.serenity.escalation.repository;

import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.EscalationLogRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface CrisisAlertRepository {

  void insert(CrisisAlertRecord record);

  Optional<CrisisAlertRecord> findById(UUID crisisAlertId);

  Optional<CrisisAlertRecord> findByRequestId(UUID requestId);

  /** Alerts that still hold a timer: an escalation deadline or, once acknowledged, expiry. */
  List<CrisisAlertRecord> findOpen(int limit);

  /** Moves the alert to {@code target} when its current status is one of {@code from}. */
  int transition(
      UUID crisisAlertId, Set<CrisisAlertStatus> from, CrisisAlertStatus target, Instant now);

  /**
   * Moves the alert to a closing status, clears the deadline and records the resolution, when its
   * current status is one of {@code from}.
   */
  int close(
      UUID crisisAlertId,
      Set<CrisisAlertStatus> from,
      CrisisAlertStatus target,
      String resolution,
      Instant now);

  /**
   * Bumps tier and escalation level when the alert is still on {@code expectedTier} and escalating.
   */
  int escalate(UUID crisisAlertId, int expectedTier, int newTier, Instant deadline, Instant now);

  int updateDeadline(UUID crisisAlertId, Instant deadline, Instant now);

  /** Sets first_responder_id only when it is still empty and the alert is not closed. */
  int claimFirstResponder(UUID crisisAlertId, String responderId, Instant now);

  int incrementResponderCount(UUID crisisAlertId, Instant now);

  /** Flags the alert as out of tiers; returns 0 when it was already flagged. */
  int markTiersExhausted(UUID crisisAlertId, Instant now);

  long countActive();

  void insertEscalationLog(EscalationLogRecord record);

  List<EscalationLogRecord> findEscalationLogs(UUID crisisAlertId);

  int deleteEscalationLogsOlderThan(Instant threshold);
}
