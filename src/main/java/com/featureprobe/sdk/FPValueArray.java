package com.featureprobe.sdk;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;

@JsonAdapter(FPValueTypeAdapter.class)
final class FPValueArray extends FPValue {
  private static final FPValueArray EMPTY = new FPValueArray(ImmutableList.<FPValue>of());
  private final ImmutableList<FPValue> list;

  static FPValueArray fromList(List<FPValue> list) {
    return list.isEmpty() ? EMPTY : new FPValueArray(ImmutableList.copyOf(list));
  }

  private FPValueArray(ImmutableList<FPValue> list) {
    this.list = list;
  }

  @Override
  public FPValueType getType() {
    return FPValueType.ARRAY;
  }

  @Override
  public int size() {
    return list.size();
  }

  @Override
  public Iterable<FPValue> values() {
    return list;
  }

  @Override
  public FPValue get(int index) {
    if (index >= 0 && index < list.size()) {
      return list.get(index);
    }
    return ofNull();
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.beginArray();
    for (FPValue v: list) {
      v.write(writer);
    }
    writer.endArray();
  }
}
