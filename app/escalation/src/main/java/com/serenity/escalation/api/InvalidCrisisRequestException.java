package com.serenity.escalation.api;

public class InvalidCrisisRequestException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidCrisisRequestException(String message) {
    super(message);
  }
}
