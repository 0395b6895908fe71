/*
 * Where: escalation data access
 * What: persistence contract for notification_requests
 * Why: requests are written once and only closed afterwards
 */
package com.serenity.escalation.repository;

import com.serenity.escalation.model.NotificationRequestRecord;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface NotificationRequestRepository {

  void insert(NotificationRequestRecord record);

  Optional<NotificationRequestRecord> findById(UUID requestId);

  /** Sets closed_at once; returns 0 when the request was already closed. */
  int markClosed(UUID requestId, Instant closedAt);
}
