package com.featureprobe.sdk.server;

import org.slf4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import static com.featureprobe.sdk.server.HttpErrors.logEventsNetworkError;
import static com.featureprobe.sdk.server.HttpErrors.logEventsRejected;

import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts event payloads with OkHttp, sent as {@code Content-Type: application/json}. Each payload gets exactly one attempt: a failed delivery is
 * logged and the payload is dropped.
 */
final class DefaultEventSender implements EventSender {
  private static final Logger logger = Loggers.EVENTS;

  private static final MediaType JSON_CONTENT_TYPE = MediaType.get("application/json");

  private final OkHttpClient httpClient;
  private final Headers baseHeaders;

  DefaultEventSender(HttpProperties httpProperties) {
    this.httpClient = httpProperties.toHttpClientBuilder().build();
    this.baseHeaders = httpProperties.toHeadersBuilder().build();
  }

  @Override
  public void close() throws IOException {
    HttpProperties.shutdownHttpClient(httpClient);
  }

  @Override
  public boolean sendEventData(String data, int eventCount, URI eventsUri) {
    if (data == null || data.isEmpty()) {
      return true;
    }

    String description = String.format("%d event(s)", eventCount);
    Request request = new Request.Builder()
        .url(eventsUri.toASCIIString())
        .post(RequestBody.create(data.getBytes(StandardCharsets.UTF_8), JSON_CONTENT_TYPE))
        .headers(baseHeaders)
        .build();

    logger.debug("Posting {} to {} with payload: {}", description, eventsUri, data);

    long startTime = System.currentTimeMillis();
    try (Response response = httpClient.newCall(request).execute()) {
      long endTime = System.currentTimeMillis();
      logger.debug("{} delivery took {} ms, response status {}", description, endTime - startTime, response.code());
      if (response.isSuccessful()) {
        return true;
      }
      logEventsRejected(logger, eventCount, response.code());
    } catch (IOException e) {
      logEventsNetworkError(logger, eventCount, e);
    }
    return false;
  }
}
