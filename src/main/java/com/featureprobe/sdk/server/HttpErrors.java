package com.featureprobe.sdk.server;

import org.slf4j.Logger;

import java.io.IOException;

/**
 * Decides what the polling synchronizer and the event sender do after a failed request to the
 * FeatureProbe server, and logs the failure accordingly.
 */
abstract class HttpErrors {
  private HttpErrors() {}

  /**
   * Thrown by a {@link TogglesRequestor} when the server answers with a non-2xx status.
   */
  @SuppressWarnings("serial")
  static final class HttpErrorException extends Exception {
    private final int status;

    HttpErrorException(int status) {
      super(describeStatus(status));
      this.status = status;
    }

    int getStatus() {
      return status;
    }
  }

  /**
   * Tests whether a failed status may succeed if the same request is sent again later. Client
   * errors are permanent, apart from 400, 408 and 429; every other status is worth another try.
   *
   * @param status the HTTP status
   * @return false if the request will keep failing until the configuration changes
   */
  static boolean isHttpErrorRecoverable(int status) {
    boolean clientError = status >= 400 && status < 500;
    return !clientError || status == 400 || status == 408 || status == 429;
  }

  /**
   * Logs a polling response with a failed status and decides whether polling continues.
   * <p>
   * A {@code false} result tells the synchronizer to cancel its schedule and release anyone
   * waiting for the first snapshot, since the server will keep rejecting this SDK key.
   *
   * @param logger the synchronizer's logger
   * @param status the HTTP status
   * @return true if the next scheduled poll should still run
   */
  static boolean keepPollingAfter(Logger logger, int status) {
    if (isHttpErrorRecoverable(status)) {
      logger.warn("Toggles request failed with {}, will retry at next poll interval", describeStatus(status));
      return true;
    }
    logger.error("Toggles request failed with {}, polling stopped", describeStatus(status));
    return false;
  }

  /**
   * Logs a polling request that never got a response. Such requests are always retried.
   */
  static void logPollingNetworkError(Logger logger, IOException e) {
    logger.warn("Toggles request failed, will retry at next poll interval: {}", e.toString());
  }

  /**
   * Logs a rejected event post. Deliveries are never retried, so the batch is gone either way; the
   * level tells an operator whether later batches can get through.
   *
   * @param logger the sender's logger
   * @param eventCount number of events in the dropped batch
   * @param status the HTTP status
   */
  static void logEventsRejected(Logger logger, int eventCount, int status) {
    if (isHttpErrorRecoverable(status)) {
      logger.warn("Dropped {} event(s) after {}", eventCount, describeStatus(status));
    } else {
      logger.error("Dropped {} event(s) after {}; later batches will fail the same way",
          eventCount, describeStatus(status));
    }
  }

  static void logEventsNetworkError(Logger logger, int eventCount, IOException e) {
    logger.warn("Dropped {} event(s) after network error: {}", eventCount, e.toString());
  }

  static String describeStatus(int status) {
    if (status == 401 || status == 403) {
      return "HTTP " + status + " (server SDK key rejected)";
    }
    return "HTTP " + status;
  }
}
