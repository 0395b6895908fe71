/*
 * Where: escalation NATS setup
 * What: creates or updates the crisis event stream at startup
 * Why: Nats-Msg-Id deduplication needs the stream's duplicate window before the first publish
 */
package com.serenity.escalation.nats;

import com.serenity.escalation.config.CrisisEventNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = {"crisis.outbox.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class CrisisEventJetStreamBootstrap {

  private static final Logger logger =
      LoggerFactory.getLogger(CrisisEventJetStreamBootstrap.class);

  private final Connection connection;
  private final CrisisEventNatsProperties properties;

  @PostConstruct
  public void start() {
    if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("crisis.nats.events.duplicate-window must be positive");
    }
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    try {
      JetStreamStreams.upsert(connection.jetStreamManagement(), streamConfiguration);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure crisis event stream", ex);
    }
    logger.info(
        "crisis event stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }
}
