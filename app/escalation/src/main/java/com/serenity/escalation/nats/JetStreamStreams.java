package com.serenity.escalation.nats;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;

/** Stream upsert shared by the event bootstrap and the receipt subscriber. */
final class JetStreamStreams {

  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private JetStreamStreams() {}

  static void upsert(JetStreamManagement management, StreamConfiguration configuration)
      throws IOException, JetStreamApiException {
    try {
      management.updateStream(configuration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      management.addStream(configuration);
    }
  }

  static boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }
}
