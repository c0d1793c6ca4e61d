package com.featureprobe.sdk.server;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.stream.JsonReader;

import org.slf4j.Logger;

import java.io.IOException;
import java.net.URI;

import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Implementation of getting toggle data via a polling request.
 */
final class DefaultTogglesRequestor implements TogglesRequestor {
  private static final Logger logger = Loggers.SYNCHRONIZER;

  private final OkHttpClient httpClient;
  @VisibleForTesting final URI togglesUri;
  private final Headers headers;

  DefaultTogglesRequestor(HttpProperties httpProperties, URI togglesUri) {
    this.togglesUri = togglesUri;
    this.httpClient = httpProperties.toHttpClientBuilder().build();
    this.headers = httpProperties.toHeadersBuilder().build();
  }

  @Override
  public void close() {
    HttpProperties.shutdownHttpClient(httpClient);
  }

  @Override
  public Repository getRepository() throws IOException, HttpErrors.HttpErrorException, SerializationException {
    Request request = new Request.Builder()
        .url(togglesUri.toURL())
        .headers(headers)
        .get()
        .build();

    logger.debug("Making request: {}", request);

    try (Response response = httpClient.newCall(request).execute()) {
      logger.debug("Get toggles response: {}", response);
      if (!response.isSuccessful()) {
        throw new HttpErrors.HttpErrorException(response.code());
      }
      JsonReader jr = new JsonReader(response.body().charStream());
      return DataModelSerialization.parseRepository(jr);
    }
  }
}
