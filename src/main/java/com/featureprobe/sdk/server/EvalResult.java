package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPValue;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Internal container for the result of evaluating one toggle for one user.
 * <p>
 * When evaluation could not pick a variation ({@link #isDefault()}), the value is null and the caller's
 * default takes its place; the rule index and version are still reported where known.
 */
final class EvalResult {
  private final FPValue value;
  private final Integer variationIndex;
  private final Integer ruleIndex;
  private final Long version;
  private final String reason;

  private EvalResult(FPValue value, Integer variationIndex, Integer ruleIndex, Long version, String reason) {
    this.value = value;
    this.variationIndex = variationIndex;
    this.ruleIndex = ruleIndex;
    this.version = version;
    this.reason = reason;
  }

  static EvalResult of(FPValue value, int variationIndex, Integer ruleIndex, long version, String reason) {
    return new EvalResult(FPValue.normalize(value), variationIndex, ruleIndex, version, reason);
  }

  static EvalResult useDefault(Integer ruleIndex, Long version, String reason) {
    return new EvalResult(null, null, ruleIndex, version, reason);
  }

  boolean isDefault() {
    return value == null;
  }

  @Nullable
  FPValue getValue() {
    return value;
  }

  Integer getVariationIndex() {
    return variationIndex;
  }

  Integer getRuleIndex() {
    return ruleIndex;
  }

  Long getVersion() {
    return version;
  }

  String getReason() {
    return reason;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof EvalResult) {
      EvalResult o = (EvalResult)other;
      return Objects.equals(value, o.value) && Objects.equals(variationIndex, o.variationIndex)
          && Objects.equals(ruleIndex, o.ruleIndex) && Objects.equals(version, o.version)
          && Objects.equals(reason, o.reason);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, variationIndex, ruleIndex, version, reason);
  }

  @Override
  public String toString() {
    return "EvalResult(" + value + "," + variationIndex + "," + ruleIndex + "," + version + "," + reason + ")";
  }
}
