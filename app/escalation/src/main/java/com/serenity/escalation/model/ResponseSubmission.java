package com.serenity.escalation.model;

/** Outcome of a supporter response submission. */
public record ResponseSubmission(boolean accepted, boolean firstResponder, String reason) {

  public static ResponseSubmission rejected(String reason) {
    return new ResponseSubmission(false, false, reason);
  }

  public static ResponseSubmission recorded(boolean firstResponder) {
    return new ResponseSubmission(true, firstResponder, firstResponder ? "first_responder" : "recorded");
  }

  public static ResponseSubmission duplicate() {
    return new ResponseSubmission(true, false, "duplicate");
  }
}
