package com.featureprobe.sdk.server;

import java.io.Closeable;
import java.io.IOException;

/**
 * Internal abstraction for fetching a full snapshot of toggles and segments.
 */
interface TogglesRequestor extends Closeable {
  /**
   * Fetches the current snapshot.
   *
   * @return the snapshot
   * @throws IOException for a network error
   * @throws HttpErrors.HttpErrorException for an unsuccessful HTTP status
   * @throws SerializationException if the response could not be parsed
   */
  Repository getRepository() throws IOException, HttpErrors.HttpErrorException, SerializationException;
}
