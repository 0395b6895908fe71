package com.serenity.escalation.model;

public enum Channel {
  PUSH,
  SMS,
  EMAIL,
  IN_APP
}
