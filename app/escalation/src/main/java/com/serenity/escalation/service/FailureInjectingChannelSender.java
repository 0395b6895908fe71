/*
 * Where: escalation service layer
 * What: CI/test-only sender that fails deliveries for matching responders
 * Why: reproduces retry, exhaustion and early escalation end to end without a broken transport
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.ChannelMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "crisis.queue.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingChannelSender implements ChannelSender {

  private final LocalChannelSender delegate;

  @Value("${crisis.queue.failure-injection.transient-prefix:}")
  private String transientPrefix;

  @Value("${crisis.queue.failure-injection.permanent-prefix:}")
  private String permanentPrefix;

  @Override
  public boolean supports(Channel channel) {
    return true;
  }

  @Override
  public String send(ChannelMessage message) {
    if (matches(permanentPrefix, message.responderId())) {
      throw new PermanentChannelDeliveryException(
          "permanent failure injection matched responderId=" + message.responderId());
    }
    if (matches(transientPrefix, message.responderId())) {
      throw new ChannelDeliveryException(
          "transient failure injection matched responderId=" + message.responderId());
    }
    return delegate.send(message);
  }

  private boolean matches(String prefix, String responderId) {
    if (prefix == null || prefix.isBlank()) {
      return false;
    }
    return responderId.startsWith(prefix);
  }
}
