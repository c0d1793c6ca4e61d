package com.featureprobe.sdk.server;

/**
 * Provides configurable factories for the standard implementations of FeatureProbe component interfaces.
 * <p>
 * Pass the results to {@link FPConfig.Builder#synchronizer(ComponentConfigurer)} and
 * {@link FPConfig.Builder#eventRecorder(ComponentConfigurer)}:
 * <pre><code>
 *     FPConfig config = new FPConfig.Builder()
 *         .remoteUri("https://featureprobe.example.com/server")
 *         .eventRecorder(Components.noEvents())
 *         .build();
 * </code></pre>
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns the default synchronizer, which polls the toggles endpoint at the configured refresh
   * interval. This is the default if nothing else is configured.
   *
   * @return a factory for the polling synchronizer
   */
  public static ComponentConfigurer<Synchronizer> pollingSynchronizer() {
    return ComponentsImpl.POLLING_SYNCHRONIZER_FACTORY;
  }

  /**
   * Returns a synchronizer that never connects to FeatureProbe. The client serves whatever is
   * published into its {@link RepositoryStore} by other means, or caller defaults if nothing is.
   *
   * @return a factory for a synchronizer that does nothing
   */
  public static ComponentConfigurer<Synchronizer> externalUpdatesOnly() {
    return ComponentsImpl.NULL_SYNCHRONIZER_FACTORY;
  }

  /**
   * Returns the default event recorder, which posts access summaries at the configured refresh
   * interval. This is the default if nothing else is configured.
   *
   * @return a factory for the default event recorder
   */
  public static ComponentConfigurer<EventRecorder> sendEvents() {
    return ComponentsImpl.DEFAULT_EVENT_RECORDER_FACTORY;
  }

  /**
   * Returns an event recorder that discards all events.
   *
   * @return a factory for an event recorder that does nothing
   */
  public static ComponentConfigurer<EventRecorder> noEvents() {
    return ComponentsImpl.NOOP_EVENT_RECORDER_FACTORY;
  }
}
