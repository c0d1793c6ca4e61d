package com.featureprobe.sdk.server;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link Repository} for one client.
 * <p>
 * The synchronizer is the only writer; evaluations read without locking. Publishing a snapshot
 * swaps the whole reference, so readers see either the previous or the new snapshot in full.
 */
public final class RepositoryStore {
  private final AtomicReference<Repository> current = new AtomicReference<>(Repository.empty());
  private volatile boolean initialized = false;

  /**
   * Returns the current snapshot.
   *
   * @return the snapshot, never null
   */
  public Repository get() {
    return current.get();
  }

  /**
   * Replaces the current snapshot.
   *
   * @param repository the new snapshot; null is treated as an empty snapshot
   */
  public void init(Repository repository) {
    current.set(repository == null ? Repository.empty() : repository);
    initialized = true;
  }

  /**
   * Resets to an empty snapshot, so later reads do not return stale data.
   */
  public void clear() {
    current.set(Repository.empty());
  }

  /**
   * Tests whether a snapshot has ever been published.
   *
   * @return true if {@link #init(Repository)} has been called
   */
  public boolean isInitialized() {
    return initialized;
  }
}
