/*
 * Where: escalation service layer
 * What: sender that simulates delivery on every channel by logging
 * Why: lets the queue and escalation flow run without a real transport
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class LocalChannelSender implements ChannelSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalChannelSender.class);

  @Override
  public boolean supports(Channel channel) {
    return true;
  }

  @Override
  public String send(ChannelMessage message) {
    // ids only; the body may carry the subject's words
    logger.info(
        "notification simulated send recipientId={} responderId={} channel={} key={}",
        message.recipientId(),
        message.responderId(),
        message.channel(),
        message.idempotencyKey());
    return "local-" + message.idempotencyKey();
  }
}
