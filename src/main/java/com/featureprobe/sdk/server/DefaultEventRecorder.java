package com.featureprobe.sdk.server;

import com.featureprobe.sdk.server.AccessSummarizer.AccessSummary;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;

import java.io.IOException;
import java.io.StringWriter;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collects access events and periodically delivers them, with a per-toggle summary, to the event
 * collector.
 * <p>
 * {@link #record(AccessEvent)} only appends to a list under a short lock. On every tick the list is
 * swapped for an empty one and the batch is formatted and posted on a small worker pool, so a slow
 * post never delays the next tick. Delivery is best-effort: a failed batch is dropped.
 * <p>
 * A batch is handed to the worker pool under the same lock that {@link #close()} takes to stop the
 * recorder, so every swapped batch is either queued before the pool shuts down or left for close().
 */
final class DefaultEventRecorder implements EventRecorder {
  private static final Logger logger = Loggers.EVENTS;

  static final int DEFAULT_CAPACITY = 10000;
  private static final int MAX_FLUSH_THREADS = 5;

  enum State {
    CREATED,
    RUNNING,
    STOPPED
  }

  private final EventSender sender;
  private final URI eventsUri;
  @VisibleForTesting final Duration flushInterval;
  private final int capacity;
  private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
  private final ScheduledExecutorService scheduler;
  private final ExecutorService flushWorkers;

  private final Object lock = new Object();
  private List<AccessEvent> pending = new ArrayList<>();
  private volatile boolean capacityExceeded = false;

  DefaultEventRecorder(EventSender sender, URI eventsUri, Duration flushInterval, int capacity) {
    this.sender = sender;
    this.eventsUri = eventsUri;
    this.flushInterval = flushInterval;
    this.capacity = capacity;

    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("FeatureProbe-EventRecorder-%d")
        .setPriority(Thread.MIN_PRIORITY)
        .build();
    this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
    this.flushWorkers = Executors.newFixedThreadPool(MAX_FLUSH_THREADS, threadFactory);
  }

  @VisibleForTesting
  State getState() {
    return state.get();
  }

  @Override
  public void start() {
    if (state.compareAndSet(State.CREATED, State.RUNNING)) {
      logger.debug("Starting event recorder with flush interval {} ms", flushInterval.toMillis());
      scheduler.scheduleAtFixedRate(this::flush, flushInterval.toMillis(), flushInterval.toMillis(),
          TimeUnit.MILLISECONDS);
    }
  }

  @Override
  public void record(AccessEvent event) {
    if (event == null || state.get() == State.STOPPED) {
      return;
    }
    synchronized (lock) {
      if (pending.size() < capacity) {
        pending.add(event);
        return;
      }
    }
    // Waiting for room would slow down evaluation, so the event is dropped. Warn only once.
    boolean alreadyLogged = capacityExceeded;
    capacityExceeded = true;
    if (!alreadyLogged) {
      logger.warn("Exceeded event queue capacity. Increase capacity to avoid dropping events.");
    }
  }

  @Override
  public void flush() {
    synchronized (lock) {
      if (state.get() == State.STOPPED) {
        return;
      }
      List<AccessEvent> batch = swapPending();
      if (!batch.isEmpty()) {
        flushWorkers.execute(() -> deliver(batch));
      }
    }
  }

  @Override
  public void close() {
    List<AccessEvent> batch;
    synchronized (lock) {
      if (state.getAndSet(State.STOPPED) == State.STOPPED) {
        return;
      }
      batch = swapPending();
    }
    scheduler.shutdownNow();

    if (!batch.isEmpty()) {
      deliver(batch);
    }

    flushWorkers.shutdown();
    try {
      if (!flushWorkers.awaitTermination(flushInterval.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.debug("Event deliveries still in progress at shutdown were abandoned");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    try {
      sender.close();
    } catch (IOException e) {
      logger.warn("Unexpected error closing event sender: {}", e.toString());
    }
  }

  private List<AccessEvent> swapPending() {
    synchronized (lock) {
      if (pending.isEmpty()) {
        return Collections.emptyList();
      }
      List<AccessEvent> batch = pending;
      pending = new ArrayList<>();
      return batch;
    }
  }

  private void deliver(List<AccessEvent> batch) {
    AccessSummary summary = AccessSummarizer.summarize(batch);
    StringWriter writer = new StringWriter();
    try {
      EventOutputFormatter.writeOutputEvents(batch, summary, writer);
    } catch (IOException e) {
      logger.error("Unexpected error formatting {} event(s): {}", batch.size(), e.toString());
      return;
    }
    sender.sendEventData(writer.toString(), batch.size(), eventsUri);
  }
}
