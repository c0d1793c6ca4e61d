package com.featureprobe.sdk.server;

import java.io.Closeable;
import java.net.URI;

/**
 * Interface for a component that can deliver preformatted event data.
 */
interface EventSender extends Closeable {
  /**
   * Attempts to deliver an event data payload. Failures are reported through the return value,
   * never thrown.
   *
   * @param data the JSON payload
   * @param eventCount the number of events the payload describes, for logging
   * @param eventsUri the full URL to post to
   * @return true if the collector accepted the payload
   */
  boolean sendEventData(String data, int eventCount, URI eventsUri);
}
