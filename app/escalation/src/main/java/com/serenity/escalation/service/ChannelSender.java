/*
 * Where: escalation service layer
 * What: pluggable transport for one or more channels
 * Why: push/SMS/email/in-app transports are swapped without touching the queue processor
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.ChannelMessage;

public interface ChannelSender {

  boolean supports(Channel channel);

  /**
   * Sends the message and returns the transport's delivery id.
   *
   * @throws ChannelDeliveryException on a failure worth retrying
   * @throws PermanentChannelDeliveryException when the recipient or channel can never succeed
   */
  String send(ChannelMessage message);
}
