package com.serenity.escalation.service;

/** Delivery failure that no retry can fix, such as an invalid recipient or unsupported channel. */
public class PermanentChannelDeliveryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public PermanentChannelDeliveryException(String message) {
    super(message);
  }
}
