package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPValue;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.emptyList;

// IMPLEMENTATION NOTES:
//
// - Toggle, Segment, and the classes contained within them are package-private. Application code
// only ever sees them through Repository, so their details can change without breaking anyone.
//
// - Classes deserialized reflectively by Gson need an empty constructor and non-final fields. There
// is also a constructor taking all the fields, used when building objects programmatically.
//
// - List properties are never null after deserialization: normalize() (or the getter) turns
// a null into an empty list, since the server may omit empty arrays.

/**
 * Contains the internal data model for toggles and segments, as delivered by the FeatureProbe
 * server SDK API.
 * <p>
 * The details of the data model are not public to application code, so changes to it are not
 * breaking changes to the application.
 */
public abstract class DataModel {
  private DataModel() {}

  @JsonAdapter(DataModelSerialization.ToggleTypeAdapterFactory.class)
  static final class Toggle {
    private String key;
    private boolean enabled;
    private long version;
    private Serve disabledServe;
    private Serve defaultServe;
    private List<Rule> rules;
    private List<FPValue> variations;

    Toggle() {}

    Toggle(String key, boolean enabled, long version, Serve disabledServe, Serve defaultServe,
        List<Rule> rules, List<FPValue> variations) {
      this.key = key;
      this.enabled = enabled;
      this.version = version;
      this.disabledServe = disabledServe;
      this.defaultServe = defaultServe;
      this.rules = rules;
      this.variations = variations;
      normalize();
    }

    String getKey() {
      return key;
    }

    boolean isEnabled() {
      return enabled;
    }

    long getVersion() {
      return version;
    }

    Serve getDisabledServe() {
      return disabledServe;
    }

    Serve getDefaultServe() {
      return defaultServe;
    }

    // Guaranteed non-null
    List<Rule> getRules() {
      return rules;
    }

    // Guaranteed non-null, and no element is a null reference
    List<FPValue> getVariations() {
      return variations;
    }

    void normalize() {
      if (rules == null) {
        rules = emptyList();
      }
      List<FPValue> normalized = new ArrayList<>();
      if (variations != null) {
        for (FPValue v: variations) {
          normalized.add(FPValue.normalize(v));
        }
      }
      variations = normalized;
    }
  }

  /**
   * Either a fixed variation index or a percentage split. A serve with neither is treated as an
   * unresolvable serve by the evaluator.
   */
  static final class Serve {
    private Integer select;
    private Split split;

    Serve() {}

    Serve(Integer select, Split split) {
      this.select = select;
      this.split = split;
    }

    Integer getSelect() {
      return select;
    }

    Split getSplit() {
      return split;
    }
  }

  static final class Split {
    private List<List<Range>> distribution;
    private String bucketBy;
    private String salt;

    Split() {}

    Split(List<List<Range>> distribution, String bucketBy, String salt) {
      this.distribution = distribution;
      this.bucketBy = bucketBy;
      this.salt = salt;
    }

    // Guaranteed non-null; element i holds the bucket ranges that serve variation i
    List<List<Range>> getDistribution() {
      return distribution == null ? emptyList() : distribution;
    }

    String getBucketBy() {
      return bucketBy;
    }

    String getSalt() {
      return salt;
    }
  }

  /**
   * A half-open bucket interval {@code [lower, upper)}, serialized as a two-element array.
   */
  @JsonAdapter(DataModelSerialization.RangeTypeAdapter.class)
  static final class Range {
    private final int lower;
    private final int upper;

    Range(int lower, int upper) {
      this.lower = lower;
      this.upper = upper;
    }

    int getLower() {
      return lower;
    }

    int getUpper() {
      return upper;
    }

    boolean contains(int bucket) {
      return bucket >= lower && bucket < upper;
    }
  }

  static final class Rule {
    private List<Condition> conditions;
    private Serve serve;

    Rule() {}

    Rule(List<Condition> conditions, Serve serve) {
      this.conditions = conditions;
      this.serve = serve;
    }

    // Guaranteed non-null
    List<Condition> getConditions() {
      return conditions == null ? emptyList() : conditions;
    }

    Serve getServe() {
      return serve;
    }
  }

  /**
   * The kind of comparison a condition performs. Gson leaves the field null for a type this SDK
   * does not know about; such a condition never matches.
   */
  enum ConditionType {
    @SerializedName("string") STRING,
    @SerializedName("segment") SEGMENT,
    @SerializedName("datetime") DATETIME,
    @SerializedName("number") NUMBER,
    @SerializedName("semver") SEMVER
  }

  static final class Condition {
    private ConditionType type;
    private String subject;
    private String predicate;
    private List<String> objects;

    Condition() {}

    Condition(ConditionType type, String subject, String predicate, List<String> objects) {
      this.type = type;
      this.subject = subject;
      this.predicate = predicate;
      this.objects = objects;
    }

    ConditionType getType() {
      return type;
    }

    String getSubject() {
      return subject;
    }

    String getPredicate() {
      return predicate;
    }

    // Guaranteed non-null
    List<String> getObjects() {
      return objects == null ? emptyList() : objects;
    }
  }

  static final class Segment {
    private String key;
    private String uniqueId;
    private long version;
    private List<SegmentRule> rules;

    Segment() {}

    Segment(String key, String uniqueId, long version, List<SegmentRule> rules) {
      this.key = key;
      this.uniqueId = uniqueId;
      this.version = version;
      this.rules = rules;
    }

    String getKey() {
      return key;
    }

    String getUniqueId() {
      return uniqueId;
    }

    long getVersion() {
      return version;
    }

    // Guaranteed non-null
    List<SegmentRule> getRules() {
      return rules == null ? emptyList() : rules;
    }
  }

  static final class SegmentRule {
    private List<Condition> conditions;

    SegmentRule() {}

    SegmentRule(List<Condition> conditions) {
      this.conditions = conditions;
    }

    // Guaranteed non-null
    List<Condition> getConditions() {
      return conditions == null ? emptyList() : conditions;
    }
  }
}
