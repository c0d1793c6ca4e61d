package com.featureprobe.sdk;

import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * A {@code FPUser} holds the attributes of the user a toggle is being evaluated for.
 * <p>
 * The {@code key} is what percentage rollouts hash on. A user built without
 * {@link Builder#stableRollout(String)} gets a generated key, so each such user lands in an
 * arbitrary bucket; pin the key when the same user must always receive the same variation.
 * <p>
 * Attributes are plain strings and are referenced by name from toggle conditions.
 */
public final class FPUser {
  private final String key;
  private final Map<String, String> attrs;

  private FPUser(Builder builder) {
    this.key = builder.key == null ? String.valueOf(System.nanoTime()) : builder.key;
    this.attrs = ImmutableMap.copyOf(builder.attrs);
  }

  /**
   * Returns the key used for percentage rollout bucketing.
   *
   * @return the user key, never null
   */
  public String getKey() {
    return key;
  }

  /**
   * Returns the value of an attribute, if set.
   *
   * @param name the attribute name
   * @return the attribute value or null
   */
  @Nullable
  public String getAttr(String name) {
    return name == null ? null : attrs.get(name);
  }

  /**
   * Tests whether an attribute has been set.
   *
   * @param name the attribute name
   * @return true if the user has that attribute
   */
  public boolean containsAttr(String name) {
    return name != null && attrs.containsKey(name);
  }

  /**
   * Returns all attributes.
   *
   * @return an immutable map of attribute names to values
   */
  public Map<String, String> getAttrs() {
    return attrs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o instanceof FPUser) {
      FPUser other = (FPUser)o;
      return key.equals(other.key) && attrs.equals(other.attrs);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, attrs);
  }

  @Override
  public String toString() {
    return "FPUser(" + key + "," + attrs + ")";
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct {@link FPUser} objects.
   * Builder calls can be chained, enabling the following pattern:
   * <pre><code>
   * FPUser user = new FPUser.Builder()
   *      .stableRollout("user-1")
   *      .with("city", "Paris")
   *      .build();
   * </code></pre>
   */
  public static final class Builder {
    private String key;
    private final Map<String, String> attrs = new HashMap<>();

    /**
     * Creates a builder with no key and no attributes.
     */
    public Builder() {}

    /**
     * Creates a builder initialized from an existing user.
     *
     * @param user the user to copy
     */
    public Builder(FPUser user) {
      this.key = user.key;
      this.attrs.putAll(user.attrs);
    }

    /**
     * Pins the key used for percentage rollout, so repeated evaluations are reproducible.
     *
     * @param key the stable key
     * @return the builder
     */
    public Builder stableRollout(String key) {
      this.key = key;
      return this;
    }

    /**
     * Sets an attribute. A null value removes the attribute.
     *
     * @param name the attribute name
     * @param value the attribute value
     * @return the builder
     */
    public Builder with(String name, String value) {
      if (name != null) {
        if (value == null) {
          attrs.remove(name);
        } else {
          attrs.put(name, value);
        }
      }
      return this;
    }

    /**
     * Builds the configured {@link FPUser} object.
     *
     * @return the {@link FPUser}
     */
    public FPUser build() {
      return new FPUser(this);
    }
  }
}
