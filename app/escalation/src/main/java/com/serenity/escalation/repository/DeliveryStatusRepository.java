package com.serenity.escalation.repository;

import com.serenity.escalation.model.DeliveryEventRecord;
import com.serenity.escalation.model.DeliveryStatusRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Append-only delivery_events plus the realtime_delivery_status view. */
public interface DeliveryStatusRepository {

  void appendEvent(DeliveryEventRecord event);

  /**
   * Writes the status when the recipient has no row yet or the stored state ranks lower.
   *
   * @return 1 when the view advanced, 0 otherwise
   */
  int advance(DeliveryStatusRecord status);

  Optional<DeliveryStatusRecord> findByRecipientId(UUID recipientId);

  List<DeliveryStatusRecord> findByRequestId(UUID requestId);

  int deleteOlderThan(Instant threshold);
}
