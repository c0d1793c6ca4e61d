package com.featureprobe.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(FPValueTypeAdapter.class)
final class FPValueBool extends FPValue {
  private static final FPValueBool TRUE = new FPValueBool(true);
  private static final FPValueBool FALSE = new FPValueBool(false);

  private final boolean value;

  static FPValueBool fromBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  private FPValueBool(boolean value) {
    this.value = value;
  }

  @Override
  public FPValueType getType() {
    return FPValueType.BOOLEAN;
  }

  @Override
  public boolean booleanValue() {
    return value;
  }

  @Override
  public String toJsonString() {
    return value ? "true" : "false";
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.value(value);
  }
}
