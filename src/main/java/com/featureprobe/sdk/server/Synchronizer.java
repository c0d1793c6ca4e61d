package com.featureprobe.sdk.server;

import java.io.Closeable;
import java.util.concurrent.Future;

/**
 * Interface for an object that keeps the client's {@link RepositoryStore} up to date.
 * <p>
 * Use {@link Components} to get the built-in implementations.
 */
public interface Synchronizer extends Closeable {
  /**
   * Starts the synchronizer.
   *
   * @return {@link Future}'s completion status indicates the client has been initialized
   */
  Future<Void> start();

  /**
   * Returns true once the synchronizer has published its first snapshot.
   *
   * @return true if initialized
   */
  boolean isInitialized();
}
