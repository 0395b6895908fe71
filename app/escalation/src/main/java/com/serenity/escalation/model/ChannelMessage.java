/*
 * Where: escalation model
 * What: rendered notification handed to a channel sender
 * Why: the queue item id travels as idempotency key so transports can drop redeliveries
 */
package com.serenity.escalation.model;

import java.util.UUID;

public record ChannelMessage(
    String idempotencyKey,
    UUID recipientId,
    String responderId,
    Channel channel,
    String subject,
    String body) {}
