/*
 * Where: escalation service layer
 * What: deletes processed queue items, old delivery status rows, escalation logs and published events
 * Why: audit tables grow with every alert; open alerts' rows are never touched
 */
package com.serenity.escalation.service;

import com.serenity.escalation.config.CrisisOutboxProperties;
import com.serenity.escalation.config.RetentionProperties;
import com.serenity.escalation.repository.CrisisAlertRepository;
import com.serenity.escalation.repository.CrisisEventOutboxRepository;
import com.serenity.escalation.repository.DeliveryStatusRepository;
import com.serenity.escalation.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EscalationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(EscalationRetentionService.class);

  private final NotificationQueueRepository queueRepository;
  private final DeliveryStatusRepository deliveryStatusRepository;
  private final CrisisAlertRepository alertRepository;
  private final CrisisEventOutboxRepository outboxRepository;
  private final RetentionProperties properties;
  private final CrisisOutboxProperties outboxProperties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final int deletedQueueItems =
        queueRepository.deleteProcessedOlderThan(
            now.minus(Duration.ofDays(properties.queueRetentionDays())));
    final int deletedStatuses =
        deliveryStatusRepository.deleteOlderThan(
            now.minus(Duration.ofDays(properties.deliveryStatusRetentionDays())));
    final int deletedLogs =
        alertRepository.deleteEscalationLogsOlderThan(
            now.minus(Duration.ofDays(properties.escalationLogRetentionDays())));
    final int deletedEvents =
        outboxRepository.deletePublishedOlderThan(now.minus(outboxProperties.publishedTtl()));
    logger.info(
        "escalation retention cleanup deleted queueItems={} deliveryStatuses={} escalationLogs={}"
            + " publishedEvents={}",
        deletedQueueItems,
        deletedStatuses,
        deletedLogs,
        deletedEvents);
  }
}
