package com.featureprobe.sdk.server;

import java.io.Closeable;

/**
 * Interface for an object that collects access events and delivers them as summaries.
 * <p>
 * Use {@link Components} to get the built-in implementations.
 */
public interface EventRecorder extends Closeable {
  /**
   * Begins periodic delivery. Calling it again has no effect.
   */
  void start();

  /**
   * Records an access event for delivery. Never blocks on network I/O.
   *
   * @param event the event
   */
  void record(AccessEvent event);

  /**
   * Triggers an asynchronous delivery of whatever has been recorded so far.
   */
  void flush();

  /**
   * Stops periodic delivery, delivers any pending events once, and releases resources. Calling it
   * again has no effect.
   */
  @Override
  void close();
}
