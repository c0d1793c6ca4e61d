package com.featureprobe.sdk.server;

/**
 * The common interface for SDK component factories. Applications normally obtain one from
 * {@link Components} rather than implementing it.
 *
 * @param <T> the type of SDK component being constructed
 */
public interface ComponentConfigurer<T> {
  /**
   * Called internally by the SDK to create an implementation instance.
   *
   * @param clientContext provides configuration properties and shared components of the client
   * @return an instance of the component type
   */
  T build(ClientContext clientContext);
}
