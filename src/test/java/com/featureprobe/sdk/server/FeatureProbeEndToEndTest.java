package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPUser;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.launchdarkly.testhelpers.httptest.Handler;
import com.launchdarkly.testhelpers.httptest.Handlers;
import com.launchdarkly.testhelpers.httptest.HttpServer;
import com.launchdarkly.testhelpers.httptest.RequestInfo;

import org.junit.Test;

import java.time.Duration;

import static com.featureprobe.sdk.server.TestUtil.fixtureRepoJson;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class FeatureProbeEndToEndTest extends BaseTest {
  private static final FPUser USER = new FPUser.Builder().stableRollout("key11").with("city", "4").build();

  // GET serves the fixture snapshot and POST accepts events
  private static Handler makeServerHandler() {
    Handler toggles = Handlers.bodyJson(fixtureRepoJson());
    Handler events = Handlers.status(200);
    return ctx -> {
      if ("POST".equals(ctx.getRequest().getMethod())) {
        events.apply(ctx);
      } else {
        toggles.apply(ctx);
      }
    };
  }

  private static FPConfig.Builder configFor(HttpServer server) {
    return new FPConfig.Builder()
        .remoteUri(server.getUri().toString())
        .refreshInterval(Duration.ofSeconds(60))
        .startWait(Duration.ofSeconds(5));
  }

  @Test
  public void clientWaitsForFirstSnapshot() throws Exception {
    try (HttpServer server = HttpServer.start(makeServerHandler())) {
      try (FeatureProbe client = new FeatureProbe(SDK_KEY, configFor(server)
          .eventRecorder(Components.noEvents())
          .build())) {
        assertTrue(client.isInitialized());
        assertFalse(client.boolValue("bool_toggle", USER, true));

        RequestInfo req = server.getRecorder().requireRequest();
        assertEquals("/api/server-sdk/toggles", req.getPath());
        assertEquals(SDK_KEY, req.getHeader("Authorization"));
      }
    }
  }

  @Test
  public void clientFailsWithInvalidSdkKey() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(401))) {
      try (FeatureProbe client = new FeatureProbe(SDK_KEY, configFor(server)
          .refreshInterval(Duration.ofMillis(20))
          .eventRecorder(Components.noEvents())
          .build())) {
        assertFalse(client.isInitialized());
        assertTrue(client.boolValue("bool_toggle", USER, true));

        server.getRecorder().requireRequest();
        server.getRecorder().requireNoRequests(Duration.ofMillis(100));
      }
    }
  }

  @Test
  public void closeSendsPendingAccessEvents() throws Exception {
    try (HttpServer server = HttpServer.start(makeServerHandler())) {
      FeatureProbe client = new FeatureProbe(SDK_KEY, configFor(server).build());
      client.boolValue("bool_toggle", USER, true);
      client.boolValue("bool_toggle", USER, true);
      client.stringValue("string_toggle", USER, "1");
      client.close();

      RequestInfo poll = server.getRecorder().requireRequest();
      assertEquals("GET", poll.getMethod());

      RequestInfo post = server.getRecorder().requireRequest();
      assertEquals("POST", post.getMethod());
      assertEquals("/api/events", post.getPath());
      assertEquals(SDK_KEY, post.getHeader("Authorization"));

      JsonArray body = JsonParser.parseString(post.getBody()).getAsJsonArray();
      JsonObject payload = body.get(0).getAsJsonObject();
      assertEquals(3, payload.getAsJsonArray("events").size());
      JsonObject counters = payload.getAsJsonObject("access").getAsJsonObject("counters");
      assertEquals(2, counters.getAsJsonArray("bool_toggle").get(0).getAsJsonObject().get("count").getAsInt());
      assertEquals(1, counters.getAsJsonArray("string_toggle").get(0).getAsJsonObject().get("count").getAsInt());

      server.getRecorder().requireNoRequests(Duration.ofMillis(100));
    }
  }
}
