/*
 * Where: escalation model
 * What: alert severity and the queue priority it maps to
 * Why: dequeue order and tier windows both key off severity
 */
package com.serenity.escalation.model;

public enum Severity {
  LOW(25),
  MEDIUM(50),
  HIGH(75),
  CRITICAL(100);

  private final int queuePriority;

  Severity(int queuePriority) {
    this.queuePriority = queuePriority;
  }

  public int queuePriority() {
    return queuePriority;
  }
}
