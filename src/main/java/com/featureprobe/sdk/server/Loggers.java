package com.featureprobe.sdk.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static logger instances to be shared by implementation code in the main {@code com.featureprobe.sdk.server}
 * package.
 * <p>
 * Most classes here are package-private details that mean nothing to users, so logging goes through a
 * small set of stable names based on the {@link FeatureProbe} class rather than through per-class loggers.
 * That keeps SLF4J filter configuration simple.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = FeatureProbe.class.getName();
  static final String SYNCHRONIZER_LOGGER_NAME = BASE_LOGGER_NAME + ".Synchronizer";
  static final String EVALUATION_LOGGER_NAME = BASE_LOGGER_NAME + ".Evaluation";
  static final String EVENTS_LOGGER_NAME = BASE_LOGGER_NAME + ".Events";

  /**
   * The default logger instance to use for SDK messages: "com.featureprobe.sdk.server.FeatureProbe"
   */
  static final Logger MAIN = LoggerFactory.getLogger(BASE_LOGGER_NAME);

  /**
   * The logger instance to use for messages related to fetching toggle snapshots.
   */
  static final Logger SYNCHRONIZER = LoggerFactory.getLogger(SYNCHRONIZER_LOGGER_NAME);

  /**
   * The logger instance to use for messages related to toggle evaluation.
   */
  static final Logger EVALUATION = LoggerFactory.getLogger(EVALUATION_LOGGER_NAME);

  /**
   * The logger instance to use for messages related to access events.
   */
  static final Logger EVENTS = LoggerFactory.getLogger(EVENTS_LOGGER_NAME);
}
