package com.serenity.escalation.service;

public class RecipientDirectoryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RecipientDirectoryException(String message, Throwable cause) {
    super(message, cause);
  }
}
