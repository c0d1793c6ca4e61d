package com.featureprobe.sdk.server;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.featureprobe.sdk.server.HttpErrors.keepPollingAfter;
import static com.featureprobe.sdk.server.HttpErrors.logPollingNetworkError;

/**
 * Fetches a full snapshot at a fixed interval and publishes each one into the {@link RepositoryStore}.
 * <p>
 * A failed fetch leaves the last published snapshot in place and is retried at the next interval,
 * except for HTTP errors that cannot succeed on retry (such as an invalid SDK key), which stop polling.
 * <p>
 * After {@link #close()} returns, nothing is published: a fetch still in flight at that point is discarded.
 */
final class PollingSynchronizer implements Synchronizer {
  private static final Logger logger = Loggers.SYNCHRONIZER;

  @VisibleForTesting final TogglesRequestor requestor;
  private final RepositoryStore store;
  private final ScheduledExecutorService scheduler;
  @VisibleForTesting final Duration pollInterval;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final CompletableFuture<Void> initFuture = new CompletableFuture<>();
  private volatile ScheduledFuture<?> task;
  private boolean closed; // guarded by this

  PollingSynchronizer(TogglesRequestor requestor, RepositoryStore store, Duration pollInterval) {
    this.requestor = requestor;
    this.store = store;
    this.pollInterval = pollInterval;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("FeatureProbe-PollingSynchronizer-%d")
        .setPriority(Thread.MIN_PRIORITY)
        .build());
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public void close() throws IOException {
    logger.info("Closing FeatureProbe PollingSynchronizer");
    synchronized (this) {
      closed = true;
      if (task != null) {
        task.cancel(true);
        task = null;
      }
    }
    scheduler.shutdownNow();
    requestor.close();
  }

  @Override
  public Future<Void> start() {
    logger.info("Starting FeatureProbe polling synchronizer with interval: {} milliseconds",
        pollInterval.toMillis());

    synchronized (this) {
      if (task == null && !closed) {
        task = scheduler.scheduleAtFixedRate(this::poll, 0L, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
      }
    }

    return initFuture;
  }

  @VisibleForTesting
  void poll() {
    try {
      Repository repository = requestor.getRepository();
      synchronized (this) {
        if (closed) {
          logger.debug("Discarding snapshot fetched after close");
          return;
        }
        store.init(repository);
      }
      if (!initialized.getAndSet(true)) {
        logger.info("Initialized FeatureProbe client.");
        initFuture.complete(null);
      }
    } catch (HttpErrors.HttpErrorException e) {
      if (!keepPollingAfter(logger, e.getStatus())) {
        initFuture.complete(null); // if client is initializing, make it stop waiting; has no effect if already inited
        synchronized (this) {
          if (task != null) {
            task.cancel(false);
            task = null;
          }
        }
      }
    } catch (IOException e) {
      logPollingNetworkError(logger, e);
    } catch (SerializationException e) {
      logger.error("Polling request received malformed data: {}", e.toString());
    } catch (Exception e) {
      logger.error("Unexpected error from polling synchronizer: {}", e.toString());
      logger.debug(e.toString(), e);
    }
  }
}
