package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the access counters for one batch of events. Not thread-safe: each flush creates its own
 * instance from the list it swapped out of the recorder.
 */
final class AccessSummarizer {
  private AccessSummarizer() {}

  static AccessSummary summarize(List<AccessEvent> events) {
    AccessSummary summary = new AccessSummary();
    for (AccessEvent e: events) {
      summary.incrementCounter(e.getKey(), e.getIndex(), e.getVersion(), e.getValue());
      summary.noteTimestamp(e.getTime());
    }
    return summary;
  }

  static final class AccessSummary {
    // insertion order is kept so output is stable for a given batch
    final Map<CounterKey, CounterValue> counters = new LinkedHashMap<>();
    long startTime;
    long endTime;
    private boolean sawTimestamp;

    boolean isEmpty() {
      return counters.isEmpty();
    }

    void incrementCounter(String toggleKey, Integer index, Long version, FPValue value) {
      CounterKey key = new CounterKey(toggleKey, index, version);
      CounterValue counter = counters.get(key);
      if (counter != null) {
        counter.increment();
      } else {
        counters.put(key, new CounterValue(1, value));
      }
    }

    // startTime is the earliest event in the batch and endTime the latest
    void noteTimestamp(long time) {
      if (!sawTimestamp) {
        startTime = time;
        endTime = time;
        sawTimestamp = true;
        return;
      }
      startTime = Math.min(startTime, time);
      endTime = Math.max(endTime, time);
    }
  }

  static final class CounterKey {
    final String key;
    final Integer index;
    final Long version;

    CounterKey(String key, Integer index, Long version) {
      this.key = key;
      this.index = index;
      this.version = version;
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof CounterKey) {
        CounterKey o = (CounterKey)other;
        return Objects.equals(o.key, key) && Objects.equals(o.index, index) &&
            Objects.equals(o.version, version);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(key) + 31 * (Objects.hashCode(index) + 31 * Objects.hashCode(version));
    }

    @Override
    public String toString() {
      return "(" + key + "," + index + "," + version + ")";
    }
  }

  static final class CounterValue {
    long count;
    final FPValue value;

    CounterValue(long count, FPValue value) {
      this.count = count;
      this.value = value;
    }

    void increment() {
      count = count + 1;
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof CounterValue) {
        CounterValue o = (CounterValue)other;
        return count == o.count && Objects.equals(value, o.value);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(count, value);
    }

    @Override
    public String toString() {
      return "(" + count + "," + value + ")";
    }
  }
}
