package com.serenity.escalation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.serenity.escalation.config.NotificationQueueProperties;
import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.ChannelMessage;
import com.serenity.escalation.model.CrisisAlertRecord;
import com.serenity.escalation.model.CrisisAlertStatus;
import com.serenity.escalation.model.NotificationKind;
import com.serenity.escalation.model.NotificationRequestRecord;
import com.serenity.escalation.model.QueueItemRecord;
import com.serenity.escalation.model.QueueItemStatus;
import com.serenity.escalation.model.RecipientRecord;
import com.serenity.escalation.model.ResponderRole;
import com.serenity.escalation.model.Severity;
import com.serenity.escalation.repository.CrisisAlertRepository;
import com.serenity.escalation.repository.NotificationRequestRepository;
import com.serenity.escalation.repository.RecipientRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationQueueProcessorTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final NotificationQueueProperties PROPERTIES =
      new NotificationQueueProperties(
          true,
          Duration.ofSeconds(1),
          5,
          3,
          Duration.ofSeconds(5),
          Duration.ofMinutes(5),
          Duration.ofSeconds(60),
          Duration.ofSeconds(10),
          4,
          16);

  @Mock private NotificationQueue queue;
  @Mock private CrisisAlertRepository alertRepository;
  @Mock private RecipientRepository recipientRepository;
  @Mock private NotificationRequestRepository requestRepository;
  @Mock private ChannelDispatcher dispatcher;
  @Mock private DeliveryTracker tracker;
  @Mock private EscalationStateMachine stateMachine;
  @Mock private EscalationMetrics metrics;

  private NotificationQueueProcessor processor;
  private final UUID alertId = UUID.randomUUID();
  private final UUID requestId = UUID.randomUUID();
  private final UUID recipientId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    processor =
        new NotificationQueueProcessor(
            queue,
            alertRepository,
            recipientRepository,
            requestRepository,
            new NotificationMessageRenderer(),
            dispatcher,
            tracker,
            stateMachine,
            PROPERTIES,
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void backoffDoublesPerRetryAndStopsAtCap() {
    assertThat(processor.computeBackoff(1)).isEqualTo(Duration.ofSeconds(10));
    assertThat(processor.computeBackoff(2)).isEqualTo(Duration.ofSeconds(20));
    assertThat(processor.computeBackoff(5)).isEqualTo(Duration.ofSeconds(160));
    assertThat(processor.computeBackoff(6)).isEqualTo(Duration.ofMinutes(5));
    assertThat(processor.computeBackoff(70)).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void successfulSendMarksSentAndReportsToStateMachine() {
    final QueueItemRecord item = item(0);
    givenOpenAlert(CrisisAlertStatus.SCHEDULED);
    when(dispatcher.dispatch(any(ChannelMessage.class), eq(Duration.ofSeconds(10))))
        .thenReturn("dlv-1");
    when(queue.markSent(eq(item), anyString(), eq("dlv-1"))).thenReturn(true);

    processor.processItem(item);

    verify(tracker).recordSent(recipientId, "dlv-1");
    verify(metrics).recordDeliveryResult("sent");
    verify(stateMachine).onDeliverySucceeded(alertId, 1);
  }

  @Test
  void lostLeaseDiscardsSendResult() {
    final QueueItemRecord item = item(0);
    givenOpenAlert(CrisisAlertStatus.SENT);
    when(dispatcher.dispatch(any(ChannelMessage.class), any(Duration.class))).thenReturn("dlv-1");
    when(queue.markSent(eq(item), anyString(), eq("dlv-1"))).thenReturn(false);

    processor.processItem(item);

    verifyNoInteractions(tracker, stateMachine);
  }

  @Test
  void transientFailureRequeuesWithBackoffAndTruncatedError() {
    final QueueItemRecord item = item(1);
    givenOpenAlert(CrisisAlertStatus.SENT);
    when(dispatcher.dispatch(any(ChannelMessage.class), any(Duration.class)))
        .thenThrow(new ChannelDeliveryException("sender timed out after PT10S"));
    when(queue.markRetry(eq(item), anyString(), anyInt(), any(Instant.class), anyString()))
        .thenReturn(true);

    processor.processItem(item);

    verify(queue)
        .markRetry(
            eq(item), anyString(), eq(2), eq(FIXED_NOW.plusSeconds(20)), eq("sender timed out"));
    verify(metrics).recordDeliveryResult("retry");
    verifyNoInteractions(tracker, stateMachine);
  }

  @Test
  void lastTransientFailureExhaustsItemAndReportsIt() {
    final QueueItemRecord item = item(2);
    givenOpenAlert(CrisisAlertStatus.SENT);
    when(dispatcher.dispatch(any(ChannelMessage.class), any(Duration.class)))
        .thenThrow(new ChannelDeliveryException("503"));
    when(queue.markFailed(eq(item), anyString(), eq(3), eq("503"))).thenReturn(true);

    processor.processItem(item);

    verify(queue, never()).markRetry(any(), anyString(), anyInt(), any(), anyString());
    verify(tracker).recordFailed(recipientId, "retries exhausted: 503");
    verify(metrics).recordDeliveryResult("exhausted");
    verify(stateMachine).onDeliveryExhausted(alertId, recipientId, 1);
  }

  @Test
  void permanentFailureFailsImmediatelyWithoutRetry() {
    final QueueItemRecord item = item(0);
    givenOpenAlert(CrisisAlertStatus.SENT);
    when(dispatcher.dispatch(any(ChannelMessage.class), any(Duration.class)))
        .thenThrow(new PermanentChannelDeliveryException("bad token"));
    when(queue.markFailed(eq(item), anyString(), eq(0), eq("bad token"))).thenReturn(true);

    processor.processItem(item);

    verify(tracker).recordFailed(recipientId, "bad token");
    verify(stateMachine).onDeliveryFailed(alertId, 1);
    verify(stateMachine, never()).onDeliveryExhausted(any(), any(), anyInt());
  }

  @Test
  void closedAlertCancelsItemWithoutSending() {
    final QueueItemRecord item = item(0);
    when(alertRepository.findById(alertId))
        .thenReturn(Optional.of(alert(CrisisAlertStatus.CANCELLED)));
    when(queue.markCancelled(eq(item), anyString(), anyString())).thenReturn(true);

    processor.processItem(item);

    verifyNoInteractions(dispatcher, tracker);
    verify(metrics).recordDeliveryResult("cancelled");
  }

  @Test
  void missingRecipientFailsItem() {
    final QueueItemRecord item = item(0);
    when(alertRepository.findById(alertId)).thenReturn(Optional.of(alert(CrisisAlertStatus.SENT)));
    when(recipientRepository.findById(recipientId)).thenReturn(Optional.empty());
    when(requestRepository.findById(requestId)).thenReturn(Optional.of(request()));

    processor.processItem(item);

    verify(queue).markFailed(eq(item), anyString(), eq(0), eq("recipient or request missing"));
    verifyNoInteractions(dispatcher);
  }

  @Test
  void itemWhoseLeaseRanOutIsNotSent() {
    final QueueItemRecord item = item(0).toBuilder().leaseUntil(FIXED_NOW).build();
    givenOpenAlert(CrisisAlertStatus.SENT);

    processor.processItem(item);

    verifyNoInteractions(dispatcher, tracker, stateMachine);
    verify(queue, never()).markSent(any(), anyString(), anyString());
    verify(queue, never()).markRetry(any(), anyString(), anyInt(), any(), anyString());
    verify(metrics).recordDeliveryResult("lease_expired");
  }

  @Test
  void itemStillInsideItsLeaseIsSent() {
    final QueueItemRecord item = item(0).toBuilder().leaseUntil(FIXED_NOW.plusSeconds(1)).build();
    givenOpenAlert(CrisisAlertStatus.SENT);
    when(dispatcher.dispatch(any(ChannelMessage.class), any(Duration.class))).thenReturn("dlv-2");
    when(queue.markSent(eq(item), anyString(), eq("dlv-2"))).thenReturn(true);

    processor.processItem(item);

    verify(tracker).recordSent(recipientId, "dlv-2");
  }

  @Test
  void batchKeepsGoingWhenOneItemBlowsUpAndPublishesBacklog() {
    final QueueItemRecord broken = item(0);
    final QueueItemRecord healthy = item(0).toBuilder().queueItemId(UUID.randomUUID()).build();
    when(queue.claimDue(eq(5), anyString())).thenReturn(List.of(broken, healthy));
    when(alertRepository.findById(alertId))
        .thenThrow(new IllegalStateException("db down"))
        .thenReturn(Optional.of(alert(CrisisAlertStatus.RESOLVED)));
    when(queue.markCancelled(eq(healthy), anyString(), anyString())).thenReturn(true);
    when(queue.countByStatus(QueueItemStatus.QUEUED)).thenReturn(7L);

    assertThat(processor.processDueBatch()).isEqualTo(2);

    verify(queue).markCancelled(eq(healthy), anyString(), anyString());
    verify(metrics).updateQueueBacklog(7L);
  }

  private void givenOpenAlert(CrisisAlertStatus status) {
    when(alertRepository.findById(alertId)).thenReturn(Optional.of(alert(status)));
    when(recipientRepository.findById(recipientId)).thenReturn(Optional.of(recipient()));
    when(requestRepository.findById(requestId)).thenReturn(Optional.of(request()));
  }

  private QueueItemRecord item(int retryCount) {
    return QueueItemRecord.builder()
        .queueItemId(UUID.randomUUID())
        .seq(1)
        .requestId(requestId)
        .crisisAlertId(alertId)
        .recipientId(recipientId)
        .status(QueueItemStatus.PROCESSING)
        .priority(Severity.CRITICAL.queuePriority())
        .scheduledFor(FIXED_NOW)
        .retryCount(retryCount)
        .maxRetries(3)
        .createdAt(FIXED_NOW)
        .build();
  }

  private CrisisAlertRecord alert(CrisisAlertStatus status) {
    return CrisisAlertRecord.builder()
        .crisisAlertId(alertId)
        .requestId(requestId)
        .severity(Severity.CRITICAL)
        .status(status)
        .tier(1)
        .escalationDeadline(FIXED_NOW.plusSeconds(30))
        .expiresAt(FIXED_NOW.plus(Duration.ofHours(24)))
        .createdAt(FIXED_NOW)
        .updatedAt(FIXED_NOW)
        .build();
  }

  private RecipientRecord recipient() {
    return new RecipientRecord(
        recipientId, requestId, "sup-1", ResponderRole.SUPPORTER, 1, Channel.PUSH, 0, FIXED_NOW, FIXED_NOW);
  }

  private NotificationRequestRecord request() {
    return new NotificationRequestRecord(
        requestId, "user-1", "Sam", NotificationKind.CRISIS, null, null, null, FIXED_NOW, null);
  }
}
