package com.featureprobe.sdk.server;

import com.launchdarkly.testhelpers.httptest.Handlers;
import com.launchdarkly.testhelpers.httptest.HttpServer;
import com.launchdarkly.testhelpers.httptest.RequestInfo;

import org.junit.Test;

import java.time.Duration;

import static com.featureprobe.sdk.server.TestUtil.fixtureRepoJson;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class DefaultTogglesRequestorTest extends BaseTest {
  private static DefaultTogglesRequestor makeRequestor(HttpServer server) {
    return new DefaultTogglesRequestor(HttpProperties.forServerSdkKey(SDK_KEY, Duration.ofSeconds(2)),
        server.getUri().resolve("/api/server-sdk/toggles"));
  }

  @Test
  public void requestsSnapshot() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.bodyJson(fixtureRepoJson()))) {
      try (DefaultTogglesRequestor r = makeRequestor(server)) {
        Repository repo = r.getRepository();
        assertThat(repo.getSegmentKeys(), containsInAnyOrder("some_segment1-fjoaefjaam"));
        assertEquals(6, repo.getToggleKeys().size());

        RequestInfo req = server.getRecorder().requireRequest();
        assertEquals("GET", req.getMethod());
        assertEquals("/api/server-sdk/toggles", req.getPath());
        assertEquals(SDK_KEY, req.getHeader("Authorization"));
        assertEquals("Java/" + Version.SDK_VERSION, req.getHeader("User-Agent"));
      }
    }
  }

  @Test
  public void errorStatusThrowsHttpError() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(403))) {
      try (DefaultTogglesRequestor r = makeRequestor(server)) {
        try {
          r.getRepository();
          fail("expected exception");
        } catch (HttpErrors.HttpErrorException e) {
          assertEquals(403, e.getStatus());
        }
      }
    }
  }

  @Test(expected = SerializationException.class)
  public void malformedBodyThrowsSerializationException() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.bodyJson("{\"toggles\":[1,2"))) {
      try (DefaultTogglesRequestor r = makeRequestor(server)) {
        r.getRepository();
      }
    }
  }
}
