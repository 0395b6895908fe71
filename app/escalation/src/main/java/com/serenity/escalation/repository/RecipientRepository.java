package com.serenity.escalation.repository;

import com.serenity.escalation.model.RecipientRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RecipientRepository {

  /**
   * Inserts the recipient unless the responder is already a recipient of the request.
   *
   * @return true when a row was written
   */
  boolean insertIfAbsent(RecipientRecord record);

  Optional<RecipientRecord> findById(UUID recipientId);

  Optional<RecipientRecord> findByRequestAndResponder(UUID requestId, String responderId);

  List<RecipientRecord> findByRequestId(UUID requestId);

  List<RecipientRecord> findByRequestAndTier(UUID requestId, int tier);
}
