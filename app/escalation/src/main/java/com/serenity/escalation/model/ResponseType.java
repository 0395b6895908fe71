/*
 * Where: escalation model
 * What: supporter response kinds
 * Why: only engaging responses claim the first-responder slot and stop escalation
 */
package com.serenity.escalation.model;

public enum ResponseType {
  ACKNOWLEDGED(true),
  MADE_CONTACT(true),
  NEEDS_HELP(false),
  CALL_911(true),
  UNAVAILABLE(false);

  private final boolean engaging;

  ResponseType(boolean engaging) {
    this.engaging = engaging;
  }

  public boolean engaging() {
    return engaging;
  }
}
