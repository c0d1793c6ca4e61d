package com.featureprobe.sdk.server;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * This class contains the package-private implementations of component factories returned by the
 * public methods in {@link Components}.
 */
abstract class ComponentsImpl {
  private ComponentsImpl() {}

  static final ComponentConfigurer<Synchronizer> POLLING_SYNCHRONIZER_FACTORY = context -> {
    Loggers.SYNCHRONIZER.info("Polling for toggles at {}", context.getTogglesUri());
    TogglesRequestor requestor = new DefaultTogglesRequestor(context.getHttp(), context.getTogglesUri());
    return new PollingSynchronizer(requestor, context.getRepositoryStore(), context.getRefreshInterval());
  };

  static final ComponentConfigurer<Synchronizer> NULL_SYNCHRONIZER_FACTORY = context -> {
    Loggers.MAIN.info("FeatureProbe client will not connect to FeatureProbe for toggle data");
    return NullSynchronizer.INSTANCE;
  };

  static final ComponentConfigurer<EventRecorder> DEFAULT_EVENT_RECORDER_FACTORY = context ->
      new DefaultEventRecorder(new DefaultEventSender(context.getHttp()), context.getEventsUri(),
          context.getRefreshInterval(), DefaultEventRecorder.DEFAULT_CAPACITY);

  static final ComponentConfigurer<EventRecorder> NOOP_EVENT_RECORDER_FACTORY = context -> NoOpEventRecorder.INSTANCE;

  // Package-private for visibility in tests
  static final class NullSynchronizer implements Synchronizer {
    static final Synchronizer INSTANCE = new NullSynchronizer();

    @Override
    public Future<Void> start() {
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isInitialized() {
      return true;
    }

    @Override
    public void close() {}
  }

  static final class NoOpEventRecorder implements EventRecorder {
    static final EventRecorder INSTANCE = new NoOpEventRecorder();

    @Override
    public void start() {}

    @Override
    public void record(AccessEvent event) {}

    @Override
    public void flush() {}

    @Override
    public void close() {}
  }
}
