package com.serenity.escalation.model;

public enum EscalationReason {
  TIMEOUT("timeout"),
  DELIVERY_FAILED("delivery_failed");

  private final String value;

  EscalationReason(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static EscalationReason fromValue(String value) {
    for (EscalationReason reason : values()) {
      if (reason.value.equals(value)) {
        return reason;
      }
    }
    throw new IllegalArgumentException("unknown escalation reason: " + value);
  }
}
