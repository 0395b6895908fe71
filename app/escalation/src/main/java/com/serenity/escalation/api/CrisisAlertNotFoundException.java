package com.serenity.escalation.api;

public class CrisisAlertNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public CrisisAlertNotFoundException(String what, Object id) {
    super(what + " not found: " + id);
  }
}
