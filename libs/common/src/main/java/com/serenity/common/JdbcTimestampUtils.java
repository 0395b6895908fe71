/*
 * Where: shared utilities
 * What: converts Instant to java.sql.Timestamp explicitly for JDBC binding
 * Why: the PostgreSQL driver cannot infer a SQL type for Instant parameters
 */
package com.serenity.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps them UTC regardless of the DB session time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
