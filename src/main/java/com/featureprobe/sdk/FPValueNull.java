package com.featureprobe.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(FPValueTypeAdapter.class)
final class FPValueNull extends FPValue {
  static final FPValueNull INSTANCE = new FPValueNull();

  private FPValueNull() {}

  @Override
  public FPValueType getType() {
    return FPValueType.NULL;
  }

  @Override
  public boolean isNull() {
    return true;
  }

  @Override
  public String toJsonString() {
    return "null";
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.nullValue();
  }
}
