package com.serenity.escalation.service;

/** Transient delivery failure; the queue retries with backoff. */
public class ChannelDeliveryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ChannelDeliveryException(String message) {
    super(message);
  }

  public ChannelDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
