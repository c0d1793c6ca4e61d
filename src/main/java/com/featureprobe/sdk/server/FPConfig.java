package com.featureprobe.sdk.server;

import java.net.URI;
import java.time.Duration;

/**
 * This class exposes configuration options for the {@link FeatureProbe} client. Instances of this class
 * must be constructed with a {@link FPConfig.Builder}.
 */
public final class FPConfig {
  /**
   * The default value for {@link Builder#remoteUri(String)}.
   */
  public static final String DEFAULT_REMOTE_URI = "https://featureprobe.io/server/";

  /**
   * The default value for {@link Builder#togglesPath(String)}.
   */
  public static final String DEFAULT_TOGGLES_PATH = "api/server-sdk/toggles";

  /**
   * The default value for {@link Builder#eventsPath(String)}.
   */
  public static final String DEFAULT_EVENTS_PATH = "api/events";

  /**
   * The default value for {@link Builder#refreshInterval(Duration)}: 2 seconds.
   */
  public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMillis(2000);

  /**
   * The default value for {@link Builder#startWait(Duration)}: 5 seconds.
   */
  public static final Duration DEFAULT_START_WAIT = Duration.ofSeconds(5);

  static final FPConfig DEFAULT = new Builder().build();

  private final URI remoteUri;
  private final URI togglesUri;
  private final URI eventsUri;
  private final Duration refreshInterval;
  private final boolean waitFirstResp;
  private final Duration startWait;
  final ComponentConfigurer<Synchronizer> synchronizer;
  final ComponentConfigurer<EventRecorder> eventRecorder;

  FPConfig(Builder builder) {
    String remote = builder.remoteUri.endsWith("/") ? builder.remoteUri : builder.remoteUri + "/";
    this.remoteUri = parseHttpUri(remote);
    this.togglesUri = parseHttpUri(remote + stripLeadingSlash(builder.togglesPath));
    this.eventsUri = parseHttpUri(remote + stripLeadingSlash(builder.eventsPath));
    this.refreshInterval = builder.refreshInterval;
    this.waitFirstResp = builder.waitFirstResp;
    this.startWait = builder.startWait;
    this.synchronizer = builder.synchronizer == null ? Components.pollingSynchronizer() : builder.synchronizer;
    this.eventRecorder = builder.eventRecorder == null ? Components.sendEvents() : builder.eventRecorder;
  }

  private static String stripLeadingSlash(String path) {
    return path.startsWith("/") ? path.substring(1) : path;
  }

  private static URI parseHttpUri(String s) {
    URI uri = URI.create(s); // throws IllegalArgumentException if malformed
    if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
      throw new IllegalArgumentException("FeatureProbe URI must be an http or https URL: " + s);
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("FeatureProbe URI has no host: " + s);
    }
    return uri;
  }

  URI getRemoteUri() {
    return remoteUri;
  }

  URI getTogglesUri() {
    return togglesUri;
  }

  URI getEventsUri() {
    return eventsUri;
  }

  Duration getRefreshInterval() {
    return refreshInterval;
  }

  boolean isWaitFirstResp() {
    return waitFirstResp;
  }

  Duration getStartWait() {
    return startWait;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link FPConfig} objects. Builder calls can be chained, enabling the following pattern:
   * <pre>
   * FPConfig config = new FPConfig.Builder()
   *      .remoteUri("https://featureprobe.example.com/server")
   *      .refreshInterval(Duration.ofSeconds(5))
   *      .build()
   * </pre>
   */
  public static class Builder {
    private String remoteUri = DEFAULT_REMOTE_URI;
    private String togglesPath = DEFAULT_TOGGLES_PATH;
    private String eventsPath = DEFAULT_EVENTS_PATH;
    private Duration refreshInterval = DEFAULT_REFRESH_INTERVAL;
    private boolean waitFirstResp = true;
    private Duration startWait = DEFAULT_START_WAIT;
    private ComponentConfigurer<Synchronizer> synchronizer = null;
    private ComponentConfigurer<EventRecorder> eventRecorder = null;

    /**
     * Creates a builder with all configuration parameters set to the default
     */
    public Builder() {
    }

    /**
     * Sets the base URL of the FeatureProbe server. A trailing slash is added if missing.
     *
     * @param remoteUri the base URL
     * @return the builder
     */
    public Builder remoteUri(String remoteUri) {
      this.remoteUri = remoteUri == null ? DEFAULT_REMOTE_URI : remoteUri;
      return this;
    }

    /**
     * Overrides the path, relative to the remote URL, that toggle snapshots are fetched from.
     *
     * @param togglesPath the path
     * @return the builder
     */
    public Builder togglesPath(String togglesPath) {
      this.togglesPath = togglesPath == null ? DEFAULT_TOGGLES_PATH : togglesPath;
      return this;
    }

    /**
     * Overrides the path, relative to the remote URL, that access events are posted to.
     *
     * @param eventsPath the path
     * @return the builder
     */
    public Builder eventsPath(String eventsPath) {
      this.eventsPath = eventsPath == null ? DEFAULT_EVENTS_PATH : eventsPath;
      return this;
    }

    /**
     * Sets the interval between snapshot fetches and between event deliveries. It also bounds every
     * outbound HTTP call. The default is {@link FPConfig#DEFAULT_REFRESH_INTERVAL}.
     *
     * @param refreshInterval the interval; null or non-positive restores the default
     * @return the builder
     */
    public Builder refreshInterval(Duration refreshInterval) {
      this.refreshInterval = refreshInterval == null || refreshInterval.isZero() || refreshInterval.isNegative() ?
          DEFAULT_REFRESH_INTERVAL : refreshInterval;
      return this;
    }

    /**
     * Sets whether the {@link FeatureProbe} constructor waits for the first snapshot before
     * returning. The wait is bounded by {@link #startWait(Duration)}. The default is true.
     *
     * @param waitFirstResp true to wait
     * @return the builder
     */
    public Builder waitFirstResp(boolean waitFirstResp) {
      this.waitFirstResp = waitFirstResp;
      return this;
    }

    /**
     * Sets how long the constructor will block awaiting the first snapshot, when
     * {@link #waitFirstResp(boolean)} is enabled.
     *
     * @param startWait the maximum wait
     * @return the builder
     */
    public Builder startWait(Duration startWait) {
      this.startWait = startWait == null ? DEFAULT_START_WAIT : startWait;
      return this;
    }

    /**
     * Sets the component that keeps toggle data up to date, as returned by
     * {@link Components#pollingSynchronizer()} or {@link Components#externalUpdatesOnly()}.
     *
     * @param synchronizerConfigurer the synchronizer factory
     * @return the builder
     */
    public Builder synchronizer(ComponentConfigurer<Synchronizer> synchronizerConfigurer) {
      this.synchronizer = synchronizerConfigurer;
      return this;
    }

    /**
     * Sets the component that delivers access events, as returned by {@link Components#sendEvents()}
     * or {@link Components#noEvents()}.
     *
     * @param eventRecorderConfigurer the event recorder factory
     * @return the builder
     */
    public Builder eventRecorder(ComponentConfigurer<EventRecorder> eventRecorderConfigurer) {
      this.eventRecorder = eventRecorderConfigurer;
      return this;
    }

    /**
     * Builds the configured {@link FPConfig} object.
     *
     * @return the {@link FPConfig} configured by this builder
     * @throws IllegalArgumentException if a URL is malformed
     */
    public FPConfig build() {
      return new FPConfig(this);
    }
  }
}
