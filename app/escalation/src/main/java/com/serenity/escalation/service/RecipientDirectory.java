/*
 * Where: escalation service layer
 * What: read-only lookup of a subject's responders, grouped into tiers
 * Why: the state machine only needs ordered tiers, not how the support network is stored
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.NotificationKind;
import com.serenity.escalation.model.TieredResponder;
import java.util.List;

public interface RecipientDirectory {

  /**
   * Returns the responders opted into {@code kind} for the subject, tier 1 first.
   *
   * @throws RecipientDirectoryException when the lookup itself fails
   */
  List<TieredResponder> resolveTiers(String subjectUserId, NotificationKind kind);
}
