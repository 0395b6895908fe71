package com.serenity.escalation;

import static org.assertj.core.api.Assertions.assertThat;

import com.serenity.escalation.service.CrisisEventSink;
import com.serenity.escalation.service.OutboxCrisisEventSink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class EscalationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private CrisisEventSink crisisEventSink;

  @Test
  void contextLoadsWithOutboxSink() {
    assertThat(crisisEventSink).isInstanceOf(OutboxCrisisEventSink.class);
  }
}
