package com.featureprobe.sdk;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

final class FPValueTypeAdapter extends TypeAdapter<FPValue> {
  static final FPValueTypeAdapter INSTANCE = new FPValueTypeAdapter();

  @Override
  public FPValue read(JsonReader reader) throws IOException {
    JsonToken token = reader.peek();
    switch (token) {
    case BEGIN_ARRAY:
      FPValue.ArrayBuilder ab = FPValue.buildArray();
      reader.beginArray();
      while (reader.peek() != JsonToken.END_ARRAY) {
        ab.add(read(reader));
      }
      reader.endArray();
      return ab.build();
    case BEGIN_OBJECT:
      FPValue.ObjectBuilder ob = FPValue.buildObject();
      reader.beginObject();
      while (reader.peek() != JsonToken.END_OBJECT) {
        String key = reader.nextName();
        ob.put(key, read(reader));
      }
      reader.endObject();
      return ob.build();
    case BOOLEAN:
      return FPValue.of(reader.nextBoolean());
    case NULL:
      reader.nextNull();
      return FPValue.ofNull();
    case NUMBER:
      return FPValue.of(reader.nextDouble());
    case STRING:
      return FPValue.of(reader.nextString());
    default:
      throw new IOException("unexpected JSON token " + token);
    }
  }

  @Override
  public void write(JsonWriter writer, FPValue value) throws IOException {
    if (value == null) {
      writer.nullValue();
    } else {
      value.write(writer);
    }
  }
}
