package com.featureprobe.sdk.server;

import org.junit.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class FPConfigTest {
  @Test
  public void defaults() {
    FPConfig config = new FPConfig.Builder().build();
    assertEquals(URI.create(FPConfig.DEFAULT_REMOTE_URI), config.getRemoteUri());
    assertEquals(URI.create("https://featureprobe.io/server/api/server-sdk/toggles"), config.getTogglesUri());
    assertEquals(URI.create("https://featureprobe.io/server/api/events"), config.getEventsUri());
    assertEquals(Duration.ofMillis(2000), config.getRefreshInterval());
    assertTrue(config.isWaitFirstResp());
    assertEquals(FPConfig.DEFAULT_START_WAIT, config.getStartWait());
    assertSame(Components.pollingSynchronizer(), config.synchronizer);
    assertSame(Components.sendEvents(), config.eventRecorder);
  }

  @Test
  public void trailingSlashIsAddedToRemoteUri() {
    FPConfig config = new FPConfig.Builder().remoteUri("http://localhost:4007").build();
    assertEquals(URI.create("http://localhost:4007/"), config.getRemoteUri());
    assertEquals(URI.create("http://localhost:4007/api/server-sdk/toggles"), config.getTogglesUri());
    assertEquals(URI.create("http://localhost:4007/api/events"), config.getEventsUri());
  }

  @Test
  public void remoteUriWithPathIsKept() {
    FPConfig config = new FPConfig.Builder().remoteUri("https://example.com/featureprobe/server/").build();
    assertEquals(URI.create("https://example.com/featureprobe/server/api/events"), config.getEventsUri());
  }

  @Test
  public void pathsCanBeOverridden() {
    FPConfig config = new FPConfig.Builder()
        .remoteUri("http://localhost:4007")
        .togglesPath("/custom/toggles")
        .eventsPath("custom/events")
        .build();
    assertEquals(URI.create("http://localhost:4007/custom/toggles"), config.getTogglesUri());
    assertEquals(URI.create("http://localhost:4007/custom/events"), config.getEventsUri());
  }

  @Test
  public void refreshIntervalCanBeSet() {
    FPConfig config = new FPConfig.Builder().refreshInterval(Duration.ofSeconds(5)).build();
    assertEquals(Duration.ofSeconds(5), config.getRefreshInterval());
  }

  @Test
  public void nonPositiveRefreshIntervalRestoresDefault() {
    assertEquals(FPConfig.DEFAULT_REFRESH_INTERVAL,
        new FPConfig.Builder().refreshInterval(Duration.ZERO).build().getRefreshInterval());
    assertEquals(FPConfig.DEFAULT_REFRESH_INTERVAL,
        new FPConfig.Builder().refreshInterval(Duration.ofMillis(-5)).build().getRefreshInterval());
    assertEquals(FPConfig.DEFAULT_REFRESH_INTERVAL,
        new FPConfig.Builder().refreshInterval(null).build().getRefreshInterval());
  }

  @Test
  public void waitFirstRespCanBeDisabled() {
    assertFalse(new FPConfig.Builder().waitFirstResp(false).build().isWaitFirstResp());
  }

  @Test
  public void componentsCanBeReplaced() {
    FPConfig config = new FPConfig.Builder()
        .synchronizer(Components.externalUpdatesOnly())
        .eventRecorder(Components.noEvents())
        .build();
    assertSame(Components.externalUpdatesOnly(), config.synchronizer);
    assertSame(Components.noEvents(), config.eventRecorder);
  }

  @Test(expected = IllegalArgumentException.class)
  public void malformedRemoteUriIsRejected() {
    new FPConfig.Builder().remoteUri("http://bad host with spaces").build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void nonHttpSchemeIsRejected() {
    new FPConfig.Builder().remoteUri("ftp://example.com").build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void relativeRemoteUriIsRejected() {
    new FPConfig.Builder().remoteUri("featureprobe/server").build();
  }
}
