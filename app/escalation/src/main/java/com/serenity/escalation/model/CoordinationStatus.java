package com.serenity.escalation.model;

public enum CoordinationStatus {
  ACTIVE,
  SUPERSEDED
}
