package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPUser;
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

import org.slf4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.featureprobe.sdk.server.EvaluatorBucketing.computeBucketValue;

/**
 * Encapsulates the toggle evaluation logic. The Evaluator has no knowledge of the rest of the SDK
 * environment: it sees one toggle, one user and the segments of the snapshot the toggle came from, and
 * it never fails. Anything it cannot resolve becomes a result telling the caller to use its default.
 */
class Evaluator {
  static final String REASON_DISABLED = "Toggle disabled";
  static final String REASON_DEFAULT_RULE = "Default rule hit";
  static final String REASON_INDEX_OVERFLOW = "Variation index overflow";

  private static final Logger logger = Loggers.EVALUATION;

  private final Clock clock;

  /**
   * Represents errors that should terminate evaluation, for situations where it's simpler to use throw/catch
   * than to return an error result back up a call chain.
   */
  @SuppressWarnings("serial")
  static class EvaluationException extends RuntimeException {
    EvaluationException(String message) {
      super(message);
    }
  }

  /**
   * This object holds mutable state that Evaluator may need during an evaluation.
   */
  private static class EvaluatorState {
    private Toggle toggle;
    private Integer ruleIndex;
    private List<String> segmentStack = null;
  }

  Evaluator(Clock clock) {
    this.clock = clock;
  }

  /**
   * The client's entry point for evaluating a toggle.
   *
   * @param toggle an existing toggle
   * @param user the user being evaluated
   * @param segments the segments of the snapshot the toggle belongs to
   * @return an {@link EvalResult}, guaranteed non-null
   */
  EvalResult evaluate(Toggle toggle, FPUser user, Map<String, Segment> segments) {
    EvaluatorState state = new EvaluatorState();
    state.toggle = toggle;
    try {
      return evaluateInternal(toggle, user, segments, state);
    } catch (EvaluationException e) {
      logger.warn("Could not evaluate toggle \"{}\": {}", toggle.getKey(), e.getMessage());
      return EvalResult.useDefault(state.ruleIndex, toggle.getVersion(), e.getMessage());
    }
  }

  private EvalResult evaluateInternal(Toggle toggle, FPUser user, Map<String, Segment> segments,
      EvaluatorState state) {
    if (!toggle.isEnabled()) {
      return resolveServe(toggle.getDisabledServe(), user, state, REASON_DISABLED);
    }

    List<Rule> rules = toggle.getRules(); // guaranteed non-null
    int nRules = rules.size();
    for (int i = 0; i < nRules; i++) {
      Rule rule = rules.get(i);
      if (ruleMatchesUser(rule.getConditions(), user, segments, state)) {
        state.ruleIndex = i;
        return resolveServe(rule.getServe(), user, state, "Rule " + i + " hit");
      }
    }
    return resolveServe(toggle.getDefaultServe(), user, state, REASON_DEFAULT_RULE);
  }

  private EvalResult resolveServe(Serve serve, FPUser user, EvaluatorState state, String reason) {
    Toggle toggle = state.toggle;
    if (serve == null) {
      throw new EvaluationException("toggle has no serve for this outcome");
    }
    int index;
    if (serve.getSelect() != null) {
      index = serve.getSelect();
    } else if (serve.getSplit() != null) {
      index = variationIndexForSplit(serve.getSplit(), user, toggle.getKey());
    } else {
      throw new EvaluationException("serve has neither a select nor a split");
    }

    List<FPValue> variations = toggle.getVariations();
    if (index < 0 || index >= variations.size()) {
      logger.debug("Toggle \"{}\" resolved variation index {} but has {} variations", toggle.getKey(),
          index, variations.size());
      return EvalResult.useDefault(state.ruleIndex, toggle.getVersion(), REASON_INDEX_OVERFLOW);
    }
    return EvalResult.of(variations.get(index), index, state.ruleIndex, toggle.getVersion(), reason);
  }

  private static int variationIndexForSplit(Split split, FPUser user, String toggleKey) {
    String hashKey = user.getKey();
    if (split.getBucketBy() != null && !split.getBucketBy().isEmpty()) {
      hashKey = user.getAttr(split.getBucketBy());
      if (hashKey == null) {
        throw new EvaluationException("User with key:" + user.getKey() + " does not have attribute named: ["
            + split.getBucketBy() + "]");
      }
    }
    String salt = split.getSalt() == null || split.getSalt().isEmpty() ? toggleKey : split.getSalt();
    int bucket = computeBucketValue(hashKey, salt);

    List<List<Range>> distribution = split.getDistribution();
    int nVariations = distribution.size();
    for (int i = 0; i < nVariations; i++) {
      List<Range> ranges = distribution.get(i);
      if (ranges == null) {
        continue;
      }
      for (Range range: ranges) {
        if (range != null && range.contains(bucket)) {
          return i;
        }
      }
    }
    throw new EvaluationException("split distribution does not cover bucket " + bucket);
  }

  // Conditions within a rule are ANDed; an empty condition list always matches.
  private boolean ruleMatchesUser(List<Condition> conditions, FPUser user, Map<String, Segment> segments,
      EvaluatorState state) {
    for (Condition condition: conditions) {
      if (!conditionMatchesUser(condition, user, segments, state)) {
        return false;
      }
    }
    return true;
  }

  private boolean conditionMatchesUser(Condition condition, FPUser user, Map<String, Segment> segments,
      EvaluatorState state) {
    ConditionType type = condition.getType();
    if (type == null) {
      return false;
    }
    switch (type) {
    case SEGMENT:
      return matchSegmentCondition(condition, user, segments, state);
    case DATETIME:
      String timestamp = user.containsAttr(condition.getSubject()) ? user.getAttr(condition.getSubject())
          : String.valueOf(clock.millis() / 1000);
      return EvaluatorOperators.apply(type, condition.getPredicate(), timestamp, condition.getObjects());
    default:
      if (!user.containsAttr(condition.getSubject())) {
        return false;
      }
      return EvaluatorOperators.apply(type, condition.getPredicate(), user.getAttr(condition.getSubject()),
          condition.getObjects());
    }
  }

  private boolean matchSegmentCondition(Condition condition, FPUser user, Map<String, Segment> segments,
      EvaluatorState state) {
    String predicate = condition.getPredicate();
    if ("is in".equals(predicate)) {
      return matchAnySegment(condition.getObjects(), user, segments, state);
    } else if ("is not in".equals(predicate)) {
      return !matchAnySegment(condition.getObjects(), user, segments, state);
    }
    return false;
  }

  // For segment conditions the objects are segment keys; a user is in the set if any segment matches.
  private boolean matchAnySegment(List<String> segmentKeys, FPUser user, Map<String, Segment> segments,
      EvaluatorState state) {
    for (String segmentKey: segmentKeys) {
      if (state.segmentStack != null && state.segmentStack.contains(segmentKey)) {
        throw new EvaluationException("segment \"" + segmentKey + "\" references itself");
      }
      Segment segment = segmentKey == null ? null : segments.get(segmentKey);
      if (segment != null && segmentMatchesUser(segmentKey, segment, user, segments, state)) {
        return true;
      }
    }
    return false;
  }

  private boolean segmentMatchesUser(String segmentKey, Segment segment, FPUser user, Map<String, Segment> segments,
      EvaluatorState state) {
    if (state.segmentStack == null) {
      state.segmentStack = new ArrayList<>();
    }
    state.segmentStack.add(segmentKey);
    try {
      for (SegmentRule rule: segment.getRules()) {
        if (ruleMatchesUser(rule.getConditions(), user, segments, state)) {
          return true;
        }
      }
      return false;
    } finally {
      state.segmentStack.remove(state.segmentStack.size() - 1);
    }
  }
}
