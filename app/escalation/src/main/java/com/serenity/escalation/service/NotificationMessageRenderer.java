/*
 * Where: escalation service layer
 * What: turns a queue item into the subject/body a responder sees
 * Why: tier 1 crisis, escalated crisis and connection requests use different wording
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.Channel;
import com.serenity.escalation.model.ChannelMessage;
import com.serenity.escalation.model.NotificationKind;
import com.serenity.escalation.model.NotificationRequestRecord;
import com.serenity.escalation.model.QueueItemRecord;
import com.serenity.escalation.model.RecipientRecord;
import org.springframework.stereotype.Component;

@Component
public class NotificationMessageRenderer {

  static final String DEFAULT_DISPLAY_NAME = "Someone in your support network";
  static final String ESCALATION_REASON = "Earlier supporters have not responded yet.";

  private static final String CRISIS_TITLE = "Crisis Alert";
  private static final String ESCALATED_TITLE = "Crisis Escalated";
  private static final String CONNECTION_TITLE = "Connection Needed";

  public ChannelMessage render(
      QueueItemRecord item, RecipientRecord recipient, NotificationRequestRecord request) {
    final String userName = displayName(request);
    final String subject;
    String body;
    if (request.kind() == NotificationKind.NEED_CONNECTION) {
      subject = CONNECTION_TITLE;
      body =
          userName
              + " would appreciate a check-in when you have a moment. No emergency, just"
              + " connection needed.";
    } else if (recipient.tier() > 1) {
      subject = ESCALATED_TITLE;
      body =
          "Crisis has been escalated for "
              + userName
              + ". Additional support is needed. "
              + ESCALATION_REASON;
    } else if (isShortForm(recipient.channel())) {
      subject = CRISIS_TITLE;
      body = userName + " is in crisis and needs immediate support. Open Serenity now.";
    } else {
      subject = CRISIS_TITLE;
      body =
          userName
              + " needs immediate support. They are in crisis and need to hear from you right now."
              + " Please respond immediately.";
    }
    if (request.customMessage() != null
        && !request.customMessage().isBlank()
        && !isShortForm(recipient.channel())) {
      body = body + "\n\n\"" + request.customMessage().strip() + "\"";
    }
    return new ChannelMessage(
        item.queueItemId().toString(),
        recipient.recipientId(),
        recipient.responderId(),
        recipient.channel(),
        subject,
        body);
  }

  private static boolean isShortForm(Channel channel) {
    return channel == Channel.PUSH || channel == Channel.SMS;
  }

  private static String displayName(NotificationRequestRecord request) {
    final String name = request.subjectDisplayName();
    return name == null || name.isBlank() ? DEFAULT_DISPLAY_NAME : name.strip();
  }
}
