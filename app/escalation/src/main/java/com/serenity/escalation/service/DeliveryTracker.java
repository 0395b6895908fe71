/*
 * Where: escalation service layer
 * What: records per-recipient delivery transitions and answers tier-level questions
 * Why: delivery callbacks arrive out of order; the status view only moves forward
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.DeliveryEventRecord;
import com.serenity.escalation.model.DeliveryState;
import com.serenity.escalation.model.DeliveryStatusRecord;
import com.serenity.escalation.model.RecipientRecord;
import com.serenity.escalation.repository.DeliveryStatusRepository;
import com.serenity.escalation.repository.RecipientRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryTracker {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryTracker.class);

  private final DeliveryStatusRepository statusRepository;
  private final RecipientRepository recipientRepository;
  private final Clock clock;

  public boolean recordSent(UUID recipientId, String deliveryId) {
    return record(recipientId, DeliveryState.SENT, deliveryId, null, null);
  }

  public boolean recordDelivered(UUID recipientId, String connectionId) {
    return record(recipientId, DeliveryState.DELIVERED, null, connectionId, null);
  }

  public boolean recordFailed(UUID recipientId, String reason) {
    return record(recipientId, DeliveryState.FAILED, null, null, reason);
  }

  public boolean recordAcknowledged(UUID recipientId) {
    return record(recipientId, DeliveryState.ACKNOWLEDGED, null, null, null);
  }

  /** Latest status per recipient of the request, in recipient order. */
  public Map<UUID, DeliveryStatusRecord> status(UUID requestId) {
    final Map<UUID, DeliveryStatusRecord> result = new LinkedHashMap<>();
    for (DeliveryStatusRecord status : statusRepository.findByRequestId(requestId)) {
      result.put(status.recipientId(), status);
    }
    return result;
  }

  public Optional<DeliveryStatusRecord> statusOf(UUID recipientId) {
    return statusRepository.findByRecipientId(recipientId);
  }

  /** True when at least one recipient of the tier is in one of {@code states}. */
  public boolean hasTierReached(UUID requestId, int tier, Set<DeliveryState> states) {
    for (DeliveryStatusRecord status : statusRepository.findByRequestId(requestId)) {
      if (status.tier() == tier && states.contains(status.state())) {
        return true;
      }
    }
    return false;
  }

  /** True when the tier has recipients and every one of them is known to have failed. */
  public boolean allTierRecipientsFailed(UUID requestId, int tier) {
    final List<RecipientRecord> tierRecipients =
        recipientRepository.findByRequestAndTier(requestId, tier);
    if (tierRecipients.isEmpty()) {
      return false;
    }
    final Map<UUID, DeliveryStatusRecord> statuses = status(requestId);
    for (RecipientRecord recipient : tierRecipients) {
      final DeliveryStatusRecord status = statuses.get(recipient.recipientId());
      if (status == null || status.state() != DeliveryState.FAILED) {
        return false;
      }
    }
    return true;
  }

  private boolean record(
      UUID recipientId, DeliveryState state, String deliveryId, String connectionId, String reason) {
    final RecipientRecord recipient = recipientRepository.findById(recipientId).orElse(null);
    if (recipient == null) {
      logger.warn("delivery update for unknown recipient recipientId={} state={}", recipientId, state);
      return false;
    }
    final Instant now = Instant.now(clock);
    statusRepository.appendEvent(
        new DeliveryEventRecord(
            UUID.randomUUID(), recipientId, recipient.requestId(), state, reason, now));
    final DeliveryStatusRecord status =
        DeliveryStatusRecord.builder()
            .recipientId(recipientId)
            .requestId(recipient.requestId())
            .tier(recipient.tier())
            .connectionId(connectionId)
            .state(state)
            .deliveryId(deliveryId)
            .sentAt(state == DeliveryState.SENT ? now : null)
            .deliveredAt(state == DeliveryState.DELIVERED ? now : null)
            .ackedAt(state == DeliveryState.ACKNOWLEDGED ? now : null)
            .failedAt(state == DeliveryState.FAILED ? now : null)
            .lastReason(reason)
            .updatedAt(now)
            .build();
    final boolean advanced = statusRepository.advance(status) == 1;
    if (!advanced) {
      logger.debug(
          "delivery status kept recipientId={} ignoredState={}", recipientId, state);
    }
    return advanced;
  }
}
