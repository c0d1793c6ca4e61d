package com.featureprobe.sdk;

/**
 * Describes the kind of an {@link FPValue}. These correspond to the standard types in JSON.
 */
public enum FPValueType {
  /**
   * The value is null.
   */
  NULL,
  /**
   * The value is a boolean.
   */
  BOOLEAN,
  /**
   * The value is numeric. JSON does not distinguish integers from floating-point values.
   */
  NUMBER,
  /**
   * The value is a string.
   */
  STRING,
  /**
   * The value is an array.
   */
  ARRAY,
  /**
   * The value is an object (map).
   */
  OBJECT
}
