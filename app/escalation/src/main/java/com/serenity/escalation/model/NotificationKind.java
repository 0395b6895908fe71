package com.serenity.escalation.model;

public enum NotificationKind {
  CRISIS,
  NEED_CONNECTION
}
