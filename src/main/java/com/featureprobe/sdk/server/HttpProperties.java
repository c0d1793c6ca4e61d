package com.featureprobe.sdk.server;

import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import okhttp3.ConnectionPool;
import okhttp3.Headers;
import okhttp3.OkHttpClient;

/**
 * Internal container for HTTP parameters used by SDK components. Includes logic for creating an
 * OkHttp client.
 * <p>
 * The public configuration API does not reference any OkHttp classes; {@link FPConfig} is transformed
 * into this when the client constructs its components.
 */
final class HttpProperties {
  static final String AUTHORIZATION_HEADER = "Authorization";
  static final String USER_AGENT_HEADER = "User-Agent";
  static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final Duration connectTimeout;
  private final Duration callTimeout;
  private final Map<String, String> defaultHeaders;

  HttpProperties(Duration connectTimeout, Duration callTimeout, Map<String, String> defaultHeaders) {
    this.connectTimeout = connectTimeout;
    this.callTimeout = callTimeout;
    this.defaultHeaders = defaultHeaders == null ? ImmutableMap.<String, String>of() : ImmutableMap.copyOf(defaultHeaders);
  }

  /**
   * Builds the properties every SDK request uses: the server SDK key as the authorization value and
   * the SDK user agent. Each call is bounded by the refresh interval, so an overrunning request cannot
   * starve the next scheduled cycle.
   */
  static HttpProperties forServerSdkKey(String serverSdkKey, Duration refreshInterval) {
    Duration connectTimeout = refreshInterval.compareTo(DEFAULT_CONNECT_TIMEOUT) < 0 ?
        refreshInterval : DEFAULT_CONNECT_TIMEOUT;
    return new HttpProperties(connectTimeout, refreshInterval, ImmutableMap.of(
        AUTHORIZATION_HEADER, serverSdkKey,
        USER_AGENT_HEADER, Version.USER_AGENT
        ));
  }

  Map<String, String> getDefaultHeaders() {
    return defaultHeaders;
  }

  Duration getCallTimeout() {
    return callTimeout;
  }

  void applyToHttpClientBuilder(OkHttpClient.Builder builder) {
    builder.connectionPool(new ConnectionPool(5, 5, TimeUnit.SECONDS));
    if (connectTimeout != null && !connectTimeout.isZero()) {
      builder.connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    if (callTimeout != null && !callTimeout.isZero()) {
      builder.callTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    builder.retryOnConnectionFailure(false); // retries happen on the next scheduled cycle
  }

  OkHttpClient.Builder toHttpClientBuilder() {
    OkHttpClient.Builder builder = new OkHttpClient.Builder();
    applyToHttpClientBuilder(builder);
    return builder;
  }

  Headers.Builder toHeadersBuilder() {
    Headers.Builder builder = new Headers.Builder();
    for (Map.Entry<String, String> kv: defaultHeaders.entrySet()) {
      builder.add(kv.getKey(), kv.getValue());
    }
    return builder;
  }

  static void shutdownHttpClient(OkHttpClient client) {
    if (client.dispatcher() != null) {
      client.dispatcher().cancelAll();
      if (client.dispatcher().executorService() != null) {
        client.dispatcher().executorService().shutdown();
      }
    }
    if (client.connectionPool() != null) {
      client.connectionPool().evictAll();
    }
  }
}
