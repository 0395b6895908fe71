/*
 * Where: escalation data access
 * What: recipient directory backed by support_network_members
 * Why: active members opted into the request kind are ordered by priority and chunked into tiers
 */
package com.serenity.escalation.repository;

import com.google.common.annotations.VisibleForTesting;
import com.serenity.escalation.config.DirectoryProperties;
import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.NotificationKind;
import com.serenity.escalation.model.ResponderRole;
import com.serenity.escalation.model.TieredResponder;
import com.serenity.escalation.service.RecipientDirectory;
import com.serenity.escalation.service.RecipientDirectoryException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSupportNetworkDirectory implements RecipientDirectory {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final DirectoryProperties properties;

  @Override
  public List<TieredResponder> resolveTiers(String subjectUserId, NotificationKind kind) {
    final String optInColumn =
        kind == NotificationKind.CRISIS ? "notify_for_crisis" : "notify_for_connection";
    final String sql =
        """
        SELECT responder_id, responder_role, preferred_channel, priority_order
        FROM support_network_members
        WHERE subject_user_id = :subjectUserId
          AND is_active = TRUE
          AND %s = TRUE
        ORDER BY priority_order, responder_id
        """
            .formatted(optInColumn);
    final List<TieredResponder> ordered;
    try {
      ordered =
          jdbcTemplate.query(
              sql,
              new MapSqlParameterSource().addValue("subjectUserId", subjectUserId),
              (rs, rowNum) ->
                  new TieredResponder(
                      rs.getString("responder_id"),
                      ResponderRole.valueOf(rs.getString("responder_role")),
                      0,
                      Channel.valueOf(rs.getString("preferred_channel")),
                      rs.getInt("priority_order")));
    } catch (DataAccessException ex) {
      throw new RecipientDirectoryException("support network lookup failed", ex);
    }
    return assignTiers(ordered, properties.tierSize());
  }

  @VisibleForTesting
  static List<TieredResponder> assignTiers(List<TieredResponder> ordered, int tierSize) {
    final List<TieredResponder> tiered = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      final TieredResponder member = ordered.get(i);
      tiered.add(
          new TieredResponder(
              member.responderId(),
              member.responderRole(),
              i / tierSize + 1,
              member.channel(),
              member.priorityOrder()));
    }
    return tiered;
  }
}
