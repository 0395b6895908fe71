package com.serenity.escalation.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.serenity.escalation.AbstractPostgresContainerTest;
import com.serenity.escalation.model.DeliveryState;
import com.serenity.escalation.model.DeliveryStatusRecord;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeliveryStatusRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private DeliveryStatusRepository statusRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private final UUID requestId = UUID.randomUUID();
  private final UUID recipientId = UUID.randomUUID();
  private Instant now;

  @BeforeEach
  void setUp() {
    AlertRows.truncateAll(jdbcTemplate);
    now = Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  @Test
  void higherRankAdvancesAndKeepsEarlierFields() {
    assertThat(
            statusRepository.advance(
                status(DeliveryState.SENT).deliveryId("dlv-1").sentAt(now).build()))
        .isEqualTo(1);
    final Instant later = now.plusSeconds(3);
    assertThat(
            statusRepository.advance(
                status(DeliveryState.DELIVERED)
                    .connectionId("conn-1")
                    .deliveredAt(later)
                    .updatedAt(later)
                    .build()))
        .isEqualTo(1);

    final DeliveryStatusRecord stored = statusRepository.findByRecipientId(recipientId).orElseThrow();
    assertThat(stored.state()).isEqualTo(DeliveryState.DELIVERED);
    assertThat(stored.deliveryId()).isEqualTo("dlv-1");
    assertThat(stored.connectionId()).isEqualTo("conn-1");
    assertThat(stored.sentAt()).isEqualTo(now);
    assertThat(stored.deliveredAt()).isEqualTo(later);
  }

  @Test
  void lowerOrEqualRankIsIgnored() {
    statusRepository.advance(status(DeliveryState.DELIVERED).deliveredAt(now).build());

    assertThat(
            statusRepository.advance(
                status(DeliveryState.FAILED).failedAt(now).lastReason("bounce").build()))
        .isZero();
    assertThat(statusRepository.advance(status(DeliveryState.DELIVERED).build())).isZero();
    assertThat(statusRepository.findByRecipientId(recipientId).orElseThrow().lastReason()).isNull();
  }

  @Test
  void staleRowsAgeOut() {
    statusRepository.advance(
        status(DeliveryState.SENT).updatedAt(now.minus(40, ChronoUnit.DAYS)).build());

    assertThat(statusRepository.deleteOlderThan(now.minus(30, ChronoUnit.DAYS))).isEqualTo(1);
    assertThat(statusRepository.findByRequestId(requestId)).isEmpty();
  }

  private DeliveryStatusRecord.DeliveryStatusRecordBuilder status(DeliveryState state) {
    return DeliveryStatusRecord.builder()
        .recipientId(recipientId)
        .requestId(requestId)
        .tier(1)
        .state(state)
        .updatedAt(now);
  }
}
