package com.serenity.escalation.model;

public enum ResponderRole {
  SUPPORTER,
  PROVIDER
}
