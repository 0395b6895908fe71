package com.serenity.escalation.service;

import com.serenity.escalation.model.CrisisResource;
import java.util.List;

/** Static crisis lines returned to the person in crisis alongside every trigger response. */
public final class CrisisResources {

  private static final List<CrisisResource> RESOURCES =
      List.of(
          new CrisisResource(
              "988 Suicide & Crisis Lifeline",
              "988",
              "Call or text 988 for free, confidential support, 24/7."),
          new CrisisResource(
              "Crisis Text Line", "Text HOME to 741741", "Text with a trained crisis counselor."),
          new CrisisResource(
              "Emergency Services", "911", "Call 911 if you are in immediate danger."));

  private CrisisResources() {}

  public static List<CrisisResource> all() {
    return RESOURCES;
  }
}
