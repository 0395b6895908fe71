package com.serenity.escalation.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.serenity.escalation.AbstractPostgresContainerTest;
import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.NotificationKind;
import com.serenity.escalation.model.ResponderRole;
import com.serenity.escalation.model.TieredResponder;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcSupportNetworkDirectoryTest extends AbstractPostgresContainerTest {

  @Autowired private JdbcSupportNetworkDirectory directory;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    AlertRows.truncateAll(jdbcTemplate);
    member("sup-c", 30, true, true, true);
    member("sup-a", 10, true, true, false);
    member("sup-b", 20, true, true, true);
    member("sup-inactive", 5, false, true, true);
    member("sup-connection-only", 15, true, false, true);
  }

  @Test
  void crisisMembersAreOrderedAndChunkedIntoTiers() {
    final List<TieredResponder> tiers = directory.resolveTiers("user-1", NotificationKind.CRISIS);

    assertThat(tiers)
        .extracting(TieredResponder::responderId, TieredResponder::tier)
        .containsExactly(
            tuple("sup-a", 1),
            tuple("sup-b", 1),
            tuple("sup-c", 2));
  }

  @Test
  void connectionRequestsUseTheirOwnOptIn() {
    assertThat(directory.resolveTiers("user-1", NotificationKind.NEED_CONNECTION))
        .extracting(TieredResponder::responderId)
        .containsExactly("sup-connection-only", "sup-b", "sup-c");
  }

  @Test
  void unknownSubjectHasNoTiers() {
    assertThat(directory.resolveTiers("user-404", NotificationKind.CRISIS)).isEmpty();
  }

  @Test
  void assignTiersKeepsOrderWithinTier() {
    final List<TieredResponder> ordered =
        List.of(
            new TieredResponder("a", ResponderRole.SUPPORTER, 0, Channel.PUSH, 1),
            new TieredResponder("b", ResponderRole.PROVIDER, 0, Channel.SMS, 2),
            new TieredResponder("c", ResponderRole.SUPPORTER, 0, Channel.EMAIL, 3));

    assertThat(JdbcSupportNetworkDirectory.assignTiers(ordered, 1))
        .extracting(TieredResponder::tier)
        .containsExactly(1, 2, 3);
    assertThat(JdbcSupportNetworkDirectory.assignTiers(ordered, 5))
        .extracting(TieredResponder::tier)
        .containsExactly(1, 1, 1);
  }

  private void member(
      String responderId,
      int priority,
      boolean active,
      boolean notifyForCrisis,
      boolean notifyForConnection) {
    jdbcTemplate.update(
        """
        INSERT INTO support_network_members (
          subject_user_id, responder_id, responder_role, preferred_channel, priority_order,
          is_active, notify_for_crisis, notify_for_connection
        ) VALUES (
          'user-1', :responderId, 'SUPPORTER', 'PUSH', :priority, :active, :crisis, :connection
        )
        """,
        new MapSqlParameterSource()
            .addValue("responderId", responderId)
            .addValue("priority", priority)
            .addValue("active", active)
            .addValue("crisis", notifyForCrisis)
            .addValue("connection", notifyForConnection));
  }
}
