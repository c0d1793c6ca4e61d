package com.featureprobe.sdk.server;

/**
 * General exception class for all errors in serializing or deserializing JSON.
 * <p>
 * The SDK uses this class to avoid depending on exception types from the underlying JSON framework
 * that it uses (currently Gson). Public evaluation methods never throw it; it is only relevant when
 * parsing a snapshot with {@link Repository#fromJson(String)} or implementing a custom synchronizer.
 */
@SuppressWarnings("serial")
public class SerializationException extends RuntimeException {
  /**
   * Creates an instance.
   * @param cause the underlying exception
   */
  public SerializationException(Throwable cause) {
    super(cause);
  }
}
