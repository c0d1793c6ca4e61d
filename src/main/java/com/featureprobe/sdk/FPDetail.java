package com.featureprobe.sdk;

import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nullable;

/**
 * The result of evaluating a toggle, with a description of how the value was chosen.
 * <p>
 * The optional fields are empty when the decision did not involve them: the rule index is empty
 * unless a targeting rule matched, and the version is empty when the toggle does not exist.
 *
 * @param <T> the type of the wrapped value
 */
public final class FPDetail<T> {
  private final T value;
  private final Integer variationIndex;
  private final Integer ruleIndex;
  private final Long version;
  private final String reason;

  /**
   * Constructs an instance with all properties specified.
   *
   * @param value the value of the toggle variation, or the caller's default
   * @param variationIndex the variation index, or null
   * @param ruleIndex the index of the matched rule, or null
   * @param version the toggle version, or null
   * @param reason a description of how the value was chosen
   */
  public FPDetail(T value, @Nullable Integer variationIndex, @Nullable Integer ruleIndex, @Nullable Long version,
      String reason) {
    this.value = value;
    this.variationIndex = variationIndex;
    this.ruleIndex = ruleIndex;
    this.version = version;
    this.reason = Objects.requireNonNull(reason);
  }

  /**
   * The result of the toggle evaluation. This is the caller's default when evaluation did not
   * produce a usable value.
   *
   * @return the value or null
   */
  public T getValue() {
    return value;
  }

  /**
   * The index of the returned value within the toggle's variations.
   *
   * @return the variation index, or empty if the default was returned
   */
  public Optional<Integer> getVariationIndex() {
    return Optional.ofNullable(variationIndex);
  }

  /**
   * The zero-based index of the rule that matched.
   *
   * @return the rule index, or empty if no rule matched
   */
  public Optional<Integer> getRuleIndex() {
    return Optional.ofNullable(ruleIndex);
  }

  /**
   * The version of the toggle that was evaluated.
   *
   * @return the version, or empty if the toggle does not exist
   */
  public Optional<Long> getVersion() {
    return Optional.ofNullable(version);
  }

  /**
   * A human-readable description of how the value was chosen.
   *
   * @return the reason, never null
   */
  public String getReason() {
    return reason;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof FPDetail) {
      @SuppressWarnings("unchecked")
      FPDetail<Object> o = (FPDetail<Object>)other;
      return Objects.equals(value, o.value) && Objects.equals(variationIndex, o.variationIndex)
          && Objects.equals(ruleIndex, o.ruleIndex) && Objects.equals(version, o.version)
          && reason.equals(o.reason);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, variationIndex, ruleIndex, version, reason);
  }

  @Override
  public String toString() {
    return "{" + value + "," + variationIndex + "," + ruleIndex + "," + version + "," + reason + "}";
  }
}
