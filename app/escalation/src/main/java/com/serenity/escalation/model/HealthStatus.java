package com.serenity.escalation.model;

public enum HealthStatus {
  HEALTHY,
  WARNING,
  DEGRADED
}
