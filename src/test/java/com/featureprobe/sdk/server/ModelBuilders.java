package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPValue;
import com.featureprobe.sdk.server.DataModel.Condition;
import com.featureprobe.sdk.server.DataModel.ConditionType;
import com.featureprobe.sdk.server.DataModel.Range;
import com.featureprobe.sdk.server.DataModel.Rule;
import com.featureprobe.sdk.server.DataModel.Segment;
import com.featureprobe.sdk.server.DataModel.SegmentRule;
import com.featureprobe.sdk.server.DataModel.Serve;
import com.featureprobe.sdk.server.DataModel.Split;
import com.featureprobe.sdk.server.DataModel.Toggle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Arrays.asList;

@SuppressWarnings("javadoc")
public abstract class ModelBuilders {
  public static ToggleBuilder toggleBuilder(String key) {
    return new ToggleBuilder(key);
  }

  public static SegmentBuilder segmentBuilder(String key) {
    return new SegmentBuilder(key);
  }

  public static Serve select(int index) {
    return new Serve(index, null);
  }

  public static Serve split(List<List<Range>> distribution) {
    return split(distribution, null, null);
  }

  public static Serve split(List<List<Range>> distribution, String bucketBy, String salt) {
    return new Serve(null, new Split(distribution, bucketBy, salt));
  }

  public static List<Range> ranges(int... bounds) {
    List<Range> ret = new ArrayList<>();
    for (int i = 0; i + 1 < bounds.length; i += 2) {
      ret.add(new Range(bounds[i], bounds[i + 1]));
    }
    return ret;
  }

  public static Condition condition(ConditionType type, String subject, String predicate, String... objects) {
    return new Condition(type, subject, predicate, asList(objects));
  }

  public static Condition stringCondition(String subject, String predicate, String... objects) {
    return condition(ConditionType.STRING, subject, predicate, objects);
  }

  public static Condition segmentCondition(String predicate, String... segmentKeys) {
    return condition(ConditionType.SEGMENT, null, predicate, segmentKeys);
  }

  public static Rule rule(Serve serve, Condition... conditions) {
    return new Rule(asList(conditions), serve);
  }

  public static Map<String, Segment> segments(Segment... segments) {
    Map<String, Segment> ret = new HashMap<>();
    for (Segment s: segments) {
      ret.put(s.getKey(), s);
    }
    return ret;
  }

  public static class ToggleBuilder {
    private final String key;
    private boolean enabled = true;
    private long version = 1;
    private Serve disabledServe = select(0);
    private Serve defaultServe = select(0);
    private List<Rule> rules = new ArrayList<>();
    private List<FPValue> variations = new ArrayList<>();

    private ToggleBuilder(String key) {
      this.key = key;
    }

    public Toggle build() {
      return new Toggle(key, enabled, version, disabledServe, defaultServe, rules, variations);
    }

    public ToggleBuilder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public ToggleBuilder version(long version) {
      this.version = version;
      return this;
    }

    public ToggleBuilder disabledServe(Serve disabledServe) {
      this.disabledServe = disabledServe;
      return this;
    }

    public ToggleBuilder defaultServe(Serve defaultServe) {
      this.defaultServe = defaultServe;
      return this;
    }

    public ToggleBuilder rules(Rule... rules) {
      this.rules = asList(rules);
      return this;
    }

    public ToggleBuilder variations(FPValue... variations) {
      this.variations = asList(variations);
      return this;
    }
  }

  public static class SegmentBuilder {
    private final String key;
    private long version = 1;
    private List<SegmentRule> rules = new ArrayList<>();

    private SegmentBuilder(String key) {
      this.key = key;
    }

    public Segment build() {
      return new Segment(key, key + "-id", version, rules);
    }

    public SegmentBuilder version(long version) {
      this.version = version;
      return this;
    }

    public SegmentBuilder rule(Condition... conditions) {
      rules.add(new SegmentRule(asList(conditions)));
      return this;
    }
  }
}
