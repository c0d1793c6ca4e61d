package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPValue;

import java.util.Objects;

/**
 * Records one toggle evaluation: which toggle, what was served and why.
 */
public final class AccessEvent {
  private final long time;
  private final String key;
  private final FPValue value;
  private final Integer index;
  private final Long version;
  private final String reason;

  /**
   * Constructs an event.
   *
   * @param time the evaluation time in epoch milliseconds
   * @param key the toggle key
   * @param value the value served to the caller
   * @param index the variation index, or null if the caller's default was served
   * @param version the toggle version, or null if the toggle was not found
   * @param reason the evaluation reason
   */
  public AccessEvent(long time, String key, FPValue value, Integer index, Long version, String reason) {
    this.time = time;
    this.key = key;
    this.value = FPValue.normalize(value);
    this.index = index;
    this.version = version;
    this.reason = reason;
  }

  public long getTime() {
    return time;
  }

  public String getKey() {
    return key;
  }

  public FPValue getValue() {
    return value;
  }

  public Integer getIndex() {
    return index;
  }

  public Long getVersion() {
    return version;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof AccessEvent) {
      AccessEvent o = (AccessEvent)other;
      return time == o.time && Objects.equals(key, o.key) && value.equals(o.value)
          && Objects.equals(index, o.index) && Objects.equals(version, o.version)
          && Objects.equals(reason, o.reason);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(time, key, value, index, version, reason);
  }

  @Override
  public String toString() {
    return "AccessEvent(" + time + "," + key + "," + value + "," + index + "," + version + "," + reason + ")";
  }
}
