/*
 * Where: escalation model
 * What: one responder returned by the recipient directory with its tier
 * Why: tier 1 is notified first, deeper tiers only on escalation
 */
package com.serenity.escalation.model;

public record TieredResponder(
    String responderId, ResponderRole responderRole, int tier, Channel channel, int priorityOrder) {}
