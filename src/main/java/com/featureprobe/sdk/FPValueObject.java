package com.featureprobe.sdk;

import com.google.common.collect.ImmutableMap;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Map;

@JsonAdapter(FPValueTypeAdapter.class)
final class FPValueObject extends FPValue {
  private static final FPValueObject EMPTY = new FPValueObject(ImmutableMap.<String, FPValue>of());
  private final ImmutableMap<String, FPValue> map;

  static FPValueObject fromMap(Map<String, FPValue> map) {
    return map.isEmpty() ? EMPTY : new FPValueObject(ImmutableMap.copyOf(map));
  }

  private FPValueObject(ImmutableMap<String, FPValue> map) {
    this.map = map;
  }

  @Override
  public FPValueType getType() {
    return FPValueType.OBJECT;
  }

  @Override
  public int size() {
    return map.size();
  }

  @Override
  public Iterable<String> keys() {
    return map.keySet();
  }

  @Override
  public Iterable<FPValue> values() {
    return map.values();
  }

  @Override
  public FPValue get(String name) {
    FPValue v = name == null ? null : map.get(name);
    return v == null ? ofNull() : v;
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.beginObject();
    for (Map.Entry<String, FPValue> e: map.entrySet()) {
      writer.name(e.getKey());
      e.getValue().write(writer);
    }
    writer.endObject();
  }
}
