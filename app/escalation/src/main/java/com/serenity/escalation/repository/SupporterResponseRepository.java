package com.serenity.escalation.repository;

import com.serenity.escalation.model.ResponseSummary;
import com.serenity.escalation.model.SupporterResponseRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SupporterResponseRepository {

  void insert(SupporterResponseRecord record);

  Optional<SupporterResponseRecord> findActive(UUID crisisAlertId, String responderId);

  int supersede(UUID responseId);

  List<SupporterResponseRecord> findByCrisisAlertId(UUID crisisAlertId);

  boolean existsActiveEngaging(UUID crisisAlertId);

  /** True when the responder has ever submitted an engaging response, superseded or not. */
  boolean hasEngaged(UUID crisisAlertId, String responderId);

  ResponseSummary summarize(UUID crisisAlertId);

  /** Average seconds between alert creation and its first response, over alerts since {@code since}. */
  Double averageFirstResponseSeconds(Instant since);
}
