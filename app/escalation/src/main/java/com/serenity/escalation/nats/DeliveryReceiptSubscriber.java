/*
 * Where: escalation NATS consumer
 * What: applies DeliveryReceipt messages from channel transports to the delivery tracker
 * Why: delivered and failed receipts arrive asynchronously after the sender returned
 */
package com.serenity.escalation.nats;

import static com.google.common.base.Strings.emptyToNull;

import com.google.protobuf.InvalidProtocolBufferException;
import com.serenity.escalation.config.DeliveryReceiptNatsProperties;
import com.serenity.escalation.model.DeliveryOutcome;
import com.serenity.escalation.service.CrisisAlertService;
import com.serenity.proto.crisis.DeliveryReceipt;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = {"nats.enabled", "crisis.nats.receipts.enabled"},
    havingValue = "true",
    matchIfMissing = true)
public class DeliveryReceiptSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryReceiptSubscriber.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection is an externally managed shared resource")
  private final Connection connection;

  private final CrisisAlertService crisisAlertService;
  private final DeliveryReceiptNatsProperties properties;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public DeliveryReceiptSubscriber(
      Connection connection,
      CrisisAlertService crisisAlertService,
      DeliveryReceiptNatsProperties properties) {
    this.connection = connection;
    this.crisisAlertService = crisisAlertService;
    this.properties = properties;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      JetStreamStreams.upsert(
          connection.jetStreamManagement(),
          StreamConfiguration.builder()
              .name(properties.stream())
              .subjects(properties.subject())
              .duplicateWindow(properties.duplicateWindow())
              .build());
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(), dispatcher, this::handleMessage, false, subscribeOptions());
      logger.info(
          "delivery receipt subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start delivery receipt subscriber", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  void handleMessage(Message message) {
    final DeliveryReceipt receipt;
    final UUID recipientId;
    final DeliveryOutcome outcome;
    try {
      receipt = DeliveryReceipt.parseFrom(message.getData());
      recipientId = UUID.fromString(receipt.getRecipientId());
      outcome = toOutcome(receipt.getOutcome());
    } catch (InvalidProtocolBufferException | IllegalArgumentException ex) {
      logger.warn("delivery receipt rejected as malformed", ex);
      message.term();
      return;
    }
    try {
      crisisAlertService.recordDeliveryOutcome(
          recipientId,
          outcome,
          emptyToNull(receipt.getConnectionId()),
          emptyToNull(receipt.getReason()));
      message.ack();
    } catch (RuntimeException ex) {
      logger.warn(
          "delivery receipt processing failed receiptId={} recipientId={}",
          receipt.getReceiptId(),
          recipientId,
          ex);
      message.nak();
    }
  }

  private static DeliveryOutcome toOutcome(DeliveryReceipt.Outcome outcome) {
    return switch (outcome) {
      case DELIVERED -> DeliveryOutcome.DELIVERED;
      case FAILED -> DeliveryOutcome.FAILED;
      case ACKNOWLEDGED -> DeliveryOutcome.ACKNOWLEDGED;
      default -> throw new IllegalArgumentException("unsupported receipt outcome: " + outcome);
    };
  }

  private PushSubscribeOptions subscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }
}
