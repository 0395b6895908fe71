package com.serenity.escalation.support;

import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.EscalationLogRecord;
import com.serenity.escalation.repository.CrisisAlertRepository;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/** Mirrors the conditional updates of the JDBC repository. */
public class InMemoryCrisisAlertRepository implements CrisisAlertRepository {

  private final Map<UUID, CrisisAlertRecord> rows = new ConcurrentHashMap<>();
  private final List<EscalationLogRecord> logs = new CopyOnWriteArrayList<>();

  @Override
  public void insert(CrisisAlertRecord record) {
    rows.put(record.crisisAlertId(), record);
  }

  @Override
  public Optional<CrisisAlertRecord> findById(UUID crisisAlertId) {
    return Optional.ofNullable(rows.get(crisisAlertId));
  }

  @Override
  public Optional<CrisisAlertRecord> findByRequestId(UUID requestId) {
    return rows.values().stream().filter(row -> row.requestId().equals(requestId)).findFirst();
  }

  @Override
  public List<CrisisAlertRecord> findOpen(int limit) {
    return rows.values().stream()
        .filter(row -> CrisisAlertStatus.OPEN.contains(row.status()))
        .sorted(
            Comparator.comparing(
                (CrisisAlertRecord row) ->
                    row.escalationDeadline() == null ? row.expiresAt() : row.escalationDeadline()))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized int transition(
      UUID crisisAlertId, Set<CrisisAlertStatus> from, CrisisAlertStatus target, Instant now) {
    return update(
        crisisAlertId,
        row -> from.contains(row.status()),
        row -> row.toBuilder().status(target).updatedAt(now).build());
  }

  @Override
  public synchronized int close(
      UUID crisisAlertId,
      Set<CrisisAlertStatus> from,
      CrisisAlertStatus target,
      String resolution,
      Instant now) {
    return update(
        crisisAlertId,
        row -> from.contains(row.status()),
        row ->
            row.toBuilder()
                .status(target)
                .resolution(resolution)
                .escalationDeadline(null)
                .updatedAt(now)
                .build());
  }

  @Override
  public synchronized int escalate(
      UUID crisisAlertId, int expectedTier, int newTier, Instant deadline, Instant now) {
    return update(
        crisisAlertId,
        row ->
            row.tier() == expectedTier && CrisisAlertStatus.ESCALATING.contains(row.status()),
        row ->
            row.toBuilder()
                .tier(newTier)
                .escalationLevel(row.escalationLevel() + 1)
                .status(CrisisAlertStatus.ESCALATED)
                .escalationDeadline(deadline)
                .updatedAt(now)
                .build());
  }

  @Override
  public synchronized int updateDeadline(UUID crisisAlertId, Instant deadline, Instant now) {
    return update(
        crisisAlertId,
        row -> true,
        row -> row.toBuilder().escalationDeadline(deadline).updatedAt(now).build());
  }

  @Override
  public synchronized int claimFirstResponder(UUID crisisAlertId, String responderId, Instant now) {
    return update(
        crisisAlertId,
        row -> row.firstResponderId() == null && !row.status().isTerminal(),
        row -> row.toBuilder().firstResponderId(responderId).updatedAt(now).build());
  }

  @Override
  public synchronized int incrementResponderCount(UUID crisisAlertId, Instant now) {
    return update(
        crisisAlertId,
        row -> true,
        row -> row.toBuilder().responderCount(row.responderCount() + 1).updatedAt(now).build());
  }

  @Override
  public synchronized int markTiersExhausted(UUID crisisAlertId, Instant now) {
    return update(
        crisisAlertId,
        row -> !row.tiersExhausted(),
        row -> row.toBuilder().tiersExhausted(true).updatedAt(now).build());
  }

  @Override
  public long countActive() {
    return rows.values().stream()
        .filter(row -> CrisisAlertStatus.OPEN.contains(row.status()))
        .count();
  }

  @Override
  public void insertEscalationLog(EscalationLogRecord record) {
    logs.add(record);
  }

  @Override
  public List<EscalationLogRecord> findEscalationLogs(UUID crisisAlertId) {
    return logs.stream().filter(log -> log.crisisAlertId().equals(crisisAlertId)).toList();
  }

  @Override
  public int deleteEscalationLogsOlderThan(Instant threshold) {
    final List<EscalationLogRecord> old =
        logs.stream().filter(log -> !log.escalatedAt().isAfter(threshold)).toList();
    logs.removeAll(old);
    return old.size();
  }

  private int update(
      UUID crisisAlertId,
      Predicate<CrisisAlertRecord> condition,
      UnaryOperator<CrisisAlertRecord> change) {
    final CrisisAlertRecord row = rows.get(crisisAlertId);
    if (row == null || !condition.test(row)) {
      return 0;
    }
    rows.put(crisisAlertId, change.apply(row));
    return 1;
  }
}
