package com.featureprobe.sdk.server;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration properties and shared components that SDK components receive when the client
 * creates them.
 */
public final class ClientContext {
  private final String serverSdkKey;
  private final FPConfig config;
  private final RepositoryStore repositoryStore;
  private final HttpProperties http;

  ClientContext(String serverSdkKey, FPConfig config, RepositoryStore repositoryStore) {
    this.serverSdkKey = serverSdkKey;
    this.config = config;
    this.repositoryStore = repositoryStore;
    this.http = HttpProperties.forServerSdkKey(serverSdkKey, config.getRefreshInterval());
  }

  /**
   * Returns the server SDK key the client was created with.
   *
   * @return the SDK key
   */
  public String getServerSdkKey() {
    return serverSdkKey;
  }

  /**
   * Returns the full URL snapshots are fetched from.
   *
   * @return the toggles URI
   */
  public URI getTogglesUri() {
    return config.getTogglesUri();
  }

  /**
   * Returns the full URL access events are posted to.
   *
   * @return the events URI
   */
  public URI getEventsUri() {
    return config.getEventsUri();
  }

  /**
   * Returns the interval between snapshot fetches and between event flushes.
   *
   * @return the refresh interval
   */
  public Duration getRefreshInterval() {
    return config.getRefreshInterval();
  }

  /**
   * Returns the store a synchronizer publishes snapshots into.
   *
   * @return the repository store
   */
  public RepositoryStore getRepositoryStore() {
    return repositoryStore;
  }

  HttpProperties getHttp() {
    return http;
  }
}
