package com.serenity.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Returns the inbound trace id when present, otherwise a fresh one. */
  public static String orNew(String traceId) {
    return traceId == null || traceId.isBlank() ? newTraceId() : traceId;
  }
}
