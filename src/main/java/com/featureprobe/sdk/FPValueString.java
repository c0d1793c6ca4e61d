package com.featureprobe.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(FPValueTypeAdapter.class)
final class FPValueString extends FPValue {
  private static final FPValueString EMPTY = new FPValueString("");
  private final String value;

  static FPValueString fromString(String value) {
    return value.isEmpty() ? EMPTY : new FPValueString(value);
  }

  private FPValueString(String value) {
    this.value = value;
  }

  @Override
  public FPValueType getType() {
    return FPValueType.STRING;
  }

  @Override
  public boolean isString() {
    return true;
  }

  @Override
  public String stringValue() {
    return value;
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.value(value);
  }
}
