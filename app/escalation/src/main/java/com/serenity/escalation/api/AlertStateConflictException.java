/*
 * Where: crisis API
 * What: a resolve or cancel that the alert's current status does not allow
 * Why: mapped to 409 so callers can tell it apart from an unknown alert
 */
package com.serenity.escalation.api;

import com.serenity.escalation.model.CrisisAlertStatus;
import java.util.UUID;

public class AlertStateConflictException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public AlertStateConflictException(UUID crisisAlertId, CrisisAlertStatus status, String action) {
    super("cannot " + action + " crisis alert " + crisisAlertId + " in status " + status);
  }
}
