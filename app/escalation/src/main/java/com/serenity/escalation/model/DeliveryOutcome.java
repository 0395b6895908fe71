package com.serenity.escalation.model;

/** Outcome reported by a transport for one recipient. */
public enum DeliveryOutcome {
  DELIVERED,
  FAILED,
  ACKNOWLEDGED
}
