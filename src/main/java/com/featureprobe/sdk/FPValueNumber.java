package com.featureprobe.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(FPValueTypeAdapter.class)
final class FPValueNumber extends FPValue {
  private static final FPValueNumber ZERO = new FPValueNumber(0);
  private final double value;

  static FPValueNumber fromDouble(double value) {
    return value == 0 ? ZERO : new FPValueNumber(value);
  }

  private FPValueNumber(double value) {
    this.value = value;
  }

  @Override
  public FPValueType getType() {
    return FPValueType.NUMBER;
  }

  @Override
  public boolean isNumber() {
    return true;
  }

  @Override
  public double doubleValue() {
    return value;
  }

  private boolean isWholeNumber() {
    return value == (long)value;
  }

  @Override
  public String toJsonString() {
    return isWholeNumber() ? String.valueOf((long)value) : String.valueOf(value);
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    if (isWholeNumber()) {
      writer.value((long)value);
    } else {
      writer.value(value);
    }
  }
}
