package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPDetail;
import com.featureprobe.sdk.FPUser;
import com.featureprobe.sdk.FPValue;
import com.featureprobe.sdk.FPValueType;
import com.featureprobe.sdk.server.DataModel.Serve;
import com.featureprobe.sdk.server.DataModel.Toggle;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A client for the FeatureProbe API. Client instances are thread-safe. Applications should instantiate
 * a single {@code FeatureProbe} for the lifetime of their application.
 * <p>
 * Toggles are evaluated locally against the most recent snapshot fetched from FeatureProbe. An
 * evaluation never throws and never blocks on the network: anything that prevents a toggle from being
 * resolved returns the caller's default, and the {@code *Detail} methods report why.
 */
public final class FeatureProbe implements Closeable {
  private static final Logger logger = Loggers.MAIN;

  static final String REASON_TYPE_MISMATCH = "Value type mismatch";
  static final String REASON_USER_NOT_SPECIFIED = "User not specified";

  private final RepositoryStore repositoryStore;
  private final Synchronizer synchronizer;
  private final EventRecorder eventRecorder;
  private final Evaluator evaluator;

  /**
   * Creates a new client to connect to FeatureProbe with a custom configuration.
   * <p>
   * If {@link FPConfig.Builder#waitFirstResp(boolean)} is enabled (the default), the constructor
   * blocks until the first snapshot arrives or {@link FPConfig.Builder#startWait(java.time.Duration)} elapses,
   * whichever comes first. Until a snapshot arrives every evaluation returns the caller's default.
   *
   * @param serverSdkKey the server SDK key for your FeatureProbe project
   * @param config a client configuration object
   * @throws NullPointerException if a parameter is null
   * @throws IllegalArgumentException if the SDK key is blank or contains characters not allowed in an HTTP header
   */
  public FeatureProbe(String serverSdkKey, FPConfig config) {
    checkNotNull(config, "config must not be null");
    checkNotNull(serverSdkKey, "serverSdkKey must not be null");
    if (serverSdkKey.trim().isEmpty()) {
      throw new IllegalArgumentException("serverSdkKey must not be blank");
    }
    if (!StandardCharsets.US_ASCII.newEncoder().canEncode(serverSdkKey)) {
      throw new IllegalArgumentException("serverSdkKey contains an invalid character");
    }

    this.repositoryStore = new RepositoryStore();
    this.evaluator = new Evaluator(Clock.systemUTC());
    ClientContext context = new ClientContext(serverSdkKey, config, repositoryStore);
    this.eventRecorder = config.eventRecorder.build(context);
    this.synchronizer = config.synchronizer.build(context);

    logger.info("Starting FeatureProbe client for {}", config.getRemoteUri());
    eventRecorder.start();
    Future<Void> startFuture = synchronizer.start();
    if (config.isWaitFirstResp() && !config.getStartWait().isZero() && !config.getStartWait().isNegative()) {
      logger.info("Waiting up to {} milliseconds for FeatureProbe client to start...",
          config.getStartWait().toMillis());
      try {
        startFuture.get(config.getStartWait().toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        logger.error("Timeout encountered waiting for FeatureProbe client initialization");
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.error("Interrupted while waiting for FeatureProbe client initialization");
      } catch (Exception e) {
        logger.error("Exception encountered waiting for FeatureProbe client initialization: {}", e.toString());
        logger.debug(e.toString(), e);
      }
      if (!synchronizer.isInitialized()) {
        logger.warn("FeatureProbe client was not successfully initialized");
      }
    }
  }

  private FeatureProbe(RepositoryStore repositoryStore, Synchronizer synchronizer, EventRecorder eventRecorder) {
    this.repositoryStore = repositoryStore;
    this.synchronizer = synchronizer;
    this.eventRecorder = eventRecorder;
    this.evaluator = new Evaluator(Clock.systemUTC());
  }

  /**
   * Creates a client for unit tests of application code. Each entry becomes an enabled toggle that
   * serves the given value to every user. The client makes no network connections and records no
   * events.
   *
   * @param toggles a map of toggle keys to the value each toggle serves
   * @return a client serving those toggles
   */
  public static FeatureProbe forTest(Map<String, FPValue> toggles) {
    ImmutableMap.Builder<String, Toggle> builder = ImmutableMap.builder();
    for (Map.Entry<String, FPValue> e: toggles.entrySet()) {
      Serve serve = new Serve(0, null);
      builder.put(e.getKey(), new Toggle(e.getKey(), true, 1, serve, serve,
          Collections.emptyList(), ImmutableList.of(FPValue.normalize(e.getValue()))));
    }
    RepositoryStore store = new RepositoryStore();
    store.init(new Repository(builder.buildKeepingLast(), Collections.emptyMap()));
    return new FeatureProbe(store, ComponentsImpl.NullSynchronizer.INSTANCE,
        ComponentsImpl.NoOpEventRecorder.INSTANCE);
  }

  /**
   * Tests whether the client has received its first snapshot.
   *
   * @return true if the client is ready
   */
  public boolean isInitialized() {
    return synchronizer.isInitialized();
  }

  /**
   * Evaluates a toggle as a boolean.
   *
   * @param toggleKey the unique key of the toggle
   * @param user the user being evaluated
   * @param defaultValue returned if the toggle cannot be evaluated or is not a boolean
   * @return the served value, or {@code defaultValue}
   */
  public boolean boolValue(String toggleKey, FPUser user, boolean defaultValue) {
    return boolDetail(toggleKey, user, defaultValue).getValue();
  }

  /**
   * Evaluates a toggle as a string.
   *
   * @param toggleKey the unique key of the toggle
   * @param user the user being evaluated
   * @param defaultValue returned if the toggle cannot be evaluated or is not a string
   * @return the served value, or {@code defaultValue}
   */
  public String stringValue(String toggleKey, FPUser user, String defaultValue) {
    return stringDetail(toggleKey, user, defaultValue).getValue();
  }

  /**
   * Evaluates a toggle as a number.
   *
   * @param toggleKey the unique key of the toggle
   * @param user the user being evaluated
   * @param defaultValue returned if the toggle cannot be evaluated or is not a number
   * @return the served value, or {@code defaultValue}
   */
  public double numberValue(String toggleKey, FPUser user, double defaultValue) {
    return numberDetail(toggleKey, user, defaultValue).getValue();
  }

  /**
   * Evaluates a toggle as an arbitrary JSON value. Any kind of variation is accepted.
   *
   * @param toggleKey the unique key of the toggle
   * @param user the user being evaluated
   * @param defaultValue returned if the toggle cannot be evaluated
   * @return the served value, or {@code defaultValue}
   */
  public FPValue jsonValue(String toggleKey, FPUser user, FPValue defaultValue) {
    return jsonDetail(toggleKey, user, defaultValue).getValue();
  }

  /**
   * Evaluates a toggle as a boolean and explains the result.
   *
   * @param toggleKey the unique key of the toggle
   * @param user the user being evaluated
   * @param defaultValue returned if the toggle cannot be evaluated or is not a boolean
   * @return an {@link FPDetail} with the value and how it was chosen
   */
  public FPDetail<Boolean> boolDetail(String toggleKey, FPUser user, boolean defaultValue) {
    return evaluateTyped(toggleKey, user, defaultValue, FPValue.of(defaultValue), FPValueType.BOOLEAN,
        FPValue::booleanValue);
  }

  /**
   * Evaluates a toggle as a string and explains the result.
   *
   * @param toggleKey the unique key of the toggle
   * @param user the user being evaluated
   * @param defaultValue returned if the toggle cannot be evaluated or is not a string
   * @return an {@link FPDetail} with the value and how it was chosen
   */
  public FPDetail<String> stringDetail(String toggleKey, FPUser user, String defaultValue) {
    return evaluateTyped(toggleKey, user, defaultValue, FPValue.of(defaultValue), FPValueType.STRING,
        FPValue::stringValue);
  }

  /**
   * Evaluates a toggle as a number and explains the result.
   *
   * @param toggleKey the unique key of the toggle
   * @param user the user being evaluated
   * @param defaultValue returned if the toggle cannot be evaluated or is not a number
   * @return an {@link FPDetail} with the value and how it was chosen
   */
  public FPDetail<Double> numberDetail(String toggleKey, FPUser user, double defaultValue) {
    return evaluateTyped(toggleKey, user, defaultValue, FPValue.of(defaultValue), FPValueType.NUMBER,
        FPValue::doubleValue);
  }

  /**
   * Evaluates a toggle as an arbitrary JSON value and explains the result.
   *
   * @param toggleKey the unique key of the toggle
   * @param user the user being evaluated
   * @param defaultValue returned if the toggle cannot be evaluated
   * @return an {@link FPDetail} with the value and how it was chosen
   */
  public FPDetail<FPValue> jsonDetail(String toggleKey, FPUser user, FPValue defaultValue) {
    FPValue normalizedDefault = FPValue.normalize(defaultValue);
    return evaluateTyped(toggleKey, user, normalizedDefault, normalizedDefault, null, v -> v);
  }

  /**
   * Asks the event recorder to deliver pending events now rather than at the next interval.
   */
  public void flush() {
    eventRecorder.flush();
  }

  /**
   * Shuts down the client: stops fetching snapshots, discards the current snapshot, and stops the
   * event recorder after one final delivery of pending events.
   *
   * @throws IOException if the synchronizer could not be closed cleanly
   */
  @Override
  public void close() throws IOException {
    logger.info("Closing FeatureProbe Client");
    try {
      synchronizer.close();
    } finally {
      repositoryStore.clear();
      eventRecorder.close();
    }
  }

  @VisibleForTesting
  RepositoryStore getRepositoryStore() {
    return repositoryStore;
  }

  // requireType == null accepts any kind of value
  private <T> FPDetail<T> evaluateTyped(String toggleKey, FPUser user, T defaultValue, FPValue defaultAsValue,
      FPValueType requireType, Function<FPValue, T> converter) {
    EvalResult result = evaluateInternal(toggleKey, user);

    FPDetail<T> detail;
    AccessEvent event;
    long now = System.currentTimeMillis();
    if (result.isDefault()) {
      detail = new FPDetail<>(defaultValue, null, result.getRuleIndex(), result.getVersion(), result.getReason());
      event = new AccessEvent(now, toggleKey, defaultAsValue, null, result.getVersion(), result.getReason());
    } else if (requireType != null && result.getValue().getType() != requireType) {
      logger.debug("Toggle \"{}\" served a {} but {} was requested; returning default value", toggleKey,
          result.getValue().getType(), requireType);
      detail = new FPDetail<>(defaultValue, null, result.getRuleIndex(), result.getVersion(), REASON_TYPE_MISMATCH);
      event = new AccessEvent(now, toggleKey, result.getValue(), result.getVariationIndex(), result.getVersion(),
          REASON_TYPE_MISMATCH);
    } else {
      detail = new FPDetail<>(converter.apply(result.getValue()), result.getVariationIndex(),
          result.getRuleIndex(), result.getVersion(), result.getReason());
      event = new AccessEvent(now, toggleKey, result.getValue(), result.getVariationIndex(), result.getVersion(),
          result.getReason());
    }
    eventRecorder.record(event);
    return detail;
  }

  private EvalResult evaluateInternal(String toggleKey, FPUser user) {
    Repository repository = repositoryStore.get();
    Toggle toggle = repository == null ? null : repository.getToggle(toggleKey);
    if (toggle == null) {
      logger.debug("Unknown toggle \"{}\"; returning default value", toggleKey);
      return EvalResult.useDefault(null, null, "Toggle:[" + toggleKey + "] not exist");
    }
    if (user == null) {
      logger.warn("Null user when evaluating toggle \"{}\"; returning default value", toggleKey);
      return EvalResult.useDefault(null, toggle.getVersion(), REASON_USER_NOT_SPECIFIED);
    }
    try {
      return evaluator.evaluate(toggle, user, repository.getSegments());
    } catch (Exception e) {
      logger.error("Encountered exception while evaluating toggle \"{}\": {}", toggleKey, e.toString());
      logger.debug(e.toString(), e);
      return EvalResult.useDefault(null, toggle.getVersion(), "Evaluation error: " + e);
    }
  }
}
