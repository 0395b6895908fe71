/*
 * Where: escalation model
 * What: lifecycle event types emitted to the event sink
 * Why: the outbox stores the dotted wire name and the publisher maps it to the protobuf enum
 */
package com.serenity.escalation.model;

public enum CrisisEventType {
  ALERT_CREATED("alert.created"),
  TIER_ESCALATED("tier.escalated"),
  RESPONSE_RECORDED("response.recorded"),
  ALERT_ACKNOWLEDGED("alert.acknowledged"),
  ALERT_RESOLVED("alert.resolved"),
  ALERT_CANCELLED("alert.cancelled"),
  ALERT_NO_RECIPIENTS("alert.no_recipients"),
  ALERT_TIERS_EXHAUSTED("alert.tiers_exhausted"),
  DELIVERY_EXHAUSTED("delivery.exhausted");

  private final String wireName;

  CrisisEventType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static CrisisEventType fromWireName(String wireName) {
    for (CrisisEventType type : values()) {
      if (type.wireName.equals(wireName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown event type: " + wireName);
  }
}
