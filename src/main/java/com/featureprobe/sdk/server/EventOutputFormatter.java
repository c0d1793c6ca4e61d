package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPValue;
import com.featureprobe.sdk.server.AccessSummarizer.AccessSummary;
import com.featureprobe.sdk.server.AccessSummarizer.CounterKey;
import com.featureprobe.sdk.server.AccessSummarizer.CounterValue;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transforms access events and their summary into the JSON format the FeatureProbe event collector
 * accepts: an array holding one packed document with {@code events} and {@code access}. Rather than
 * creating intermediate objects to represent this schema, we use the Gson streaming output API to
 * construct JSON directly.
 */
final class EventOutputFormatter {
  private EventOutputFormatter() {}

  static void writeOutputEvents(List<AccessEvent> events, AccessSummary summary, Writer writer) throws IOException {
    try (JsonWriter jw = new JsonWriter(writer)) {
      jw.beginArray();
      jw.beginObject();
      jw.name("events");
      jw.beginArray();
      for (AccessEvent event: events) {
        writeAccessEvent(event, jw);
      }
      jw.endArray();
      jw.name("access");
      writeSummary(summary, jw);
      jw.endObject();
      jw.endArray();
    }
  }

  private static void writeAccessEvent(AccessEvent event, JsonWriter jw) throws IOException {
    jw.beginObject();
    jw.name("time").value(event.getTime());
    jw.name("key").value(event.getKey());
    writeFPValue("value", event.getValue(), jw);
    if (event.getIndex() != null) {
      jw.name("index").value(event.getIndex());
    }
    if (event.getVersion() != null) {
      jw.name("version").value(event.getVersion());
    }
    jw.name("reason").value(event.getReason());
    jw.endObject();
  }

  private static void writeSummary(AccessSummary summary, JsonWriter jw) throws IOException {
    // group the flat counter map by toggle key
    Map<String, List<Map.Entry<CounterKey, CounterValue>>> byToggle = new LinkedHashMap<>();
    for (Map.Entry<CounterKey, CounterValue> entry: summary.counters.entrySet()) {
      byToggle.computeIfAbsent(entry.getKey().key, k -> new ArrayList<>()).add(entry);
    }

    jw.beginObject();
    jw.name("startTime").value(summary.startTime);
    jw.name("endTime").value(summary.endTime);
    jw.name("counters");
    jw.beginObject();
    for (Map.Entry<String, List<Map.Entry<CounterKey, CounterValue>>> toggle: byToggle.entrySet()) {
      jw.name(toggle.getKey());
      jw.beginArray();
      for (Map.Entry<CounterKey, CounterValue> entry: toggle.getValue()) {
        CounterKey key = entry.getKey();
        CounterValue counter = entry.getValue();
        jw.beginObject();
        writeFPValue("value", counter.value, jw);
        if (key.version != null) {
          jw.name("version").value(key.version);
        }
        if (key.index != null) {
          jw.name("index").value(key.index);
        }
        jw.name("count").value(counter.count);
        jw.endObject();
      }
      jw.endArray();
    }
    jw.endObject();
    jw.endObject();
  }

  private static void writeFPValue(String key, FPValue value, JsonWriter jw) throws IOException {
    jw.name(key);
    jw.jsonValue(FPValue.normalize(value).toJsonString());
  }
}
