package com.featureprobe.sdk.server;

import org.junit.Test;

import java.time.Duration;

import okhttp3.Headers;
import okhttp3.OkHttpClient;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class HttpPropertiesTest {
  @Test
  public void serverSdkKeyAndUserAgentAreSent() {
    HttpProperties hp = HttpProperties.forServerSdkKey("my-key", Duration.ofSeconds(2));
    Headers headers = hp.toHeadersBuilder().build();
    assertEquals("my-key", headers.get("Authorization"));
    assertEquals("Java/" + Version.SDK_VERSION, headers.get("User-Agent"));
  }

  @Test
  public void callTimeoutIsRefreshInterval() {
    HttpProperties hp = HttpProperties.forServerSdkKey("my-key", Duration.ofMillis(2000));
    OkHttpClient client = hp.toHttpClientBuilder().build();
    try {
      assertEquals(2000, client.callTimeoutMillis());
      assertEquals(2000, client.connectTimeoutMillis());
    } finally {
      HttpProperties.shutdownHttpClient(client);
    }
  }

  @Test
  public void connectTimeoutIsCappedForLongIntervals() {
    HttpProperties hp = HttpProperties.forServerSdkKey("my-key", Duration.ofSeconds(60));
    OkHttpClient client = hp.toHttpClientBuilder().build();
    try {
      assertEquals(60000, client.callTimeoutMillis());
      assertEquals(10000, client.connectTimeoutMillis());
    } finally {
      HttpProperties.shutdownHttpClient(client);
    }
  }

  @Test
  public void recoverableStatuses() {
    assertTrue(HttpErrors.isHttpErrorRecoverable(400));
    assertTrue(HttpErrors.isHttpErrorRecoverable(429));
    assertTrue(HttpErrors.isHttpErrorRecoverable(503));
    assertFalse(HttpErrors.isHttpErrorRecoverable(401));
    assertFalse(HttpErrors.isHttpErrorRecoverable(404));
  }

  @Test
  public void pollingStopsOnlyForPermanentStatuses() {
    assertTrue(HttpErrors.keepPollingAfter(Loggers.SYNCHRONIZER, 500));
    assertTrue(HttpErrors.keepPollingAfter(Loggers.SYNCHRONIZER, 408));
    assertFalse(HttpErrors.keepPollingAfter(Loggers.SYNCHRONIZER, 401));
    assertFalse(HttpErrors.keepPollingAfter(Loggers.SYNCHRONIZER, 403));
  }

  @Test
  public void rejectedKeyIsNamedInStatusDescription() {
    assertEquals("HTTP 401 (server SDK key rejected)", HttpErrors.describeStatus(401));
    assertEquals("HTTP 503", HttpErrors.describeStatus(503));
    assertEquals("HTTP 404", new HttpErrors.HttpErrorException(404).getMessage());
  }
}
