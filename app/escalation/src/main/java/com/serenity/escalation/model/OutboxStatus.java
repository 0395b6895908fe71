package com.serenity.escalation.model;

public enum OutboxStatus {
  PENDING,
  IN_FLIGHT,
  PUBLISHED,
  FAILED
}
