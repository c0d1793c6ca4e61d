package com.featureprobe.sdk.server;

import com.featureprobe.sdk.server.DataModel.Range;
import com.featureprobe.sdk.server.DataModel.Segment;
import com.featureprobe.sdk.server.DataModel.Toggle;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringReader;

/**
 * JSON conversion logic specifically for our data model types.
 */
abstract class DataModelSerialization {
  private DataModelSerialization() {}

  private static final Gson gson = new Gson();

  static Repository parseRepository(String json) throws SerializationException {
    return parseRepository(new JsonReader(new StringReader(json)));
  }

  /**
   * Parses a full snapshot as returned by the toggles endpoint:
   * {@code {"toggles": {...}, "segments": {...}}}. Unknown top-level properties are skipped.
   */
  static Repository parseRepository(JsonReader jr) throws SerializationException {
    ImmutableMap.Builder<String, Toggle> toggles = ImmutableMap.builder();
    ImmutableMap.Builder<String, Segment> segments = ImmutableMap.builder();

    try {
      jr.beginObject();
      while (jr.peek() != JsonToken.END_OBJECT) {
        String kindName = jr.nextName();
        if (jr.peek() == JsonToken.NULL) {
          jr.nextNull();
          continue;
        }
        switch (kindName) {
        case "toggles":
          jr.beginObject();
          while (jr.peek() != JsonToken.END_OBJECT) {
            String key = jr.nextName();
            Toggle item = gson.fromJson(jr, Toggle.class);
            if (item != null) {
              toggles.put(key, item);
            }
          }
          jr.endObject();
          break;
        case "segments":
          jr.beginObject();
          while (jr.peek() != JsonToken.END_OBJECT) {
            String key = jr.nextName();
            Segment item = gson.fromJson(jr, Segment.class);
            if (item != null) {
              segments.put(key, item);
            }
          }
          jr.endObject();
          break;
        default:
          jr.skipValue();
        }
      }
      jr.endObject();

      return new Repository(toggles.buildKeepingLast(), segments.buildKeepingLast());
    } catch (IOException | RuntimeException e) {
      throw new SerializationException(e);
    }
  }

  /**
   * Reads a toggle reflectively, then fills in the lists the server omits when empty.
   */
  static final class ToggleTypeAdapterFactory implements TypeAdapterFactory {
    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
      TypeAdapter<T> reflective = gson.getDelegateAdapter(this, type);
      return new TypeAdapter<T>() {
        @Override
        public void write(JsonWriter out, T value) throws IOException {
          reflective.write(out, value);
        }

        @Override
        public T read(JsonReader in) throws IOException {
          T value = reflective.read(in);
          if (value instanceof Toggle) {
            ((Toggle)value).normalize();
          }
          return value;
        }
      };
    }
  }

  static final class RangeTypeAdapter extends TypeAdapter<Range> {
    @Override
    public void write(JsonWriter out, Range r) throws IOException {
      out.beginArray();
      out.value(r.getLower());
      out.value(r.getUpper());
      out.endArray();
    }

    @Override
    public Range read(JsonReader in) throws IOException {
      in.beginArray();
      int lower = in.nextInt();
      int upper = in.nextInt();
      if (in.peek() != JsonToken.END_ARRAY) {
        throw new JsonParseException("bucket range must have exactly two elements");
      }
      in.endArray();
      return new Range(lower, upper);
    }
  }
}
