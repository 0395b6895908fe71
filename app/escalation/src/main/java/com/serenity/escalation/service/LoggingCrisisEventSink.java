package com.serenity.escalation.service;

import com.serenity.escalation.model.CrisisEventType;
import com.serenity.escalation.model.CrisisLifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Event sink used when the outbox is disabled; events only reach the log. */
@Component
@ConditionalOnProperty(name = "crisis.outbox.enabled", havingValue = "false")
public class LoggingCrisisEventSink implements CrisisEventSink {

  private static final Logger logger = LoggerFactory.getLogger(LoggingCrisisEventSink.class);

  @Override
  public void emit(CrisisLifecycleEvent event) {
    if (event.type() == CrisisEventType.ALERT_NO_RECIPIENTS) {
      logger.error(
          "crisis event type={} crisisAlertId={} eventId={}",
          event.type().wireName(),
          event.crisisAlertId(),
          event.eventId());
      return;
    }
    logger.info(
        "crisis event type={} crisisAlertId={} tier={} eventId={}",
        event.type().wireName(),
        event.crisisAlertId(),
        event.tier(),
        event.eventId());
  }
}
