package com.featureprobe.sdk.server;

import com.featureprobe.sdk.server.DataModel.ConditionType;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

import static com.featureprobe.sdk.server.EvaluatorTypeConversion.stringToNumber;
import static com.featureprobe.sdk.server.EvaluatorTypeConversion.stringToRegex;
import static com.featureprobe.sdk.server.EvaluatorTypeConversion.stringToSemVer;
import static com.featureprobe.sdk.server.EvaluatorTypeConversion.stringToTimestamp;

/**
 * Defines the behavior of all predicates that can be used in toggle rules and segment rules, except
 * segment membership, which is implemented in {@link Evaluator}.
 * <p>
 * A predicate holds when the user value matches any of the condition's objects. A negated predicate
 * ("is not any of", "!=", ...) holds when it matches none of them.
 */
abstract class EvaluatorOperators {
  private EvaluatorOperators() {}

  private static interface OperatorFn {
    boolean match(String userValue, String object);
  }

  private static final class Predicate {
    final OperatorFn fn;
    final boolean negated;

    Predicate(OperatorFn fn, boolean negated) {
      this.fn = fn;
      this.negated = negated;
    }
  }

  private static final Map<String, Predicate> STRING_PREDICATES = new HashMap<>();
  private static final Map<String, Predicate> NUMBER_PREDICATES = new HashMap<>();
  private static final Map<String, Predicate> SEMVER_PREDICATES = new HashMap<>();
  private static final Map<String, Predicate> DATETIME_PREDICATES = new HashMap<>();
  static {
    addWithNegation(STRING_PREDICATES, "is one of", "is not any of", String::equals);
    addWithNegation(STRING_PREDICATES, "ends with", "does not end with", String::endsWith);
    addWithNegation(STRING_PREDICATES, "starts with", "does not start with", String::startsWith);
    addWithNegation(STRING_PREDICATES, "contains", "does not contain", String::contains);
    addWithNegation(STRING_PREDICATES, "matches regex", "does not match regex", EvaluatorOperators::applyRegex);

    addOrderings(NUMBER_PREDICATES, EvaluatorOperators::numericComparison);
    addOrderings(SEMVER_PREDICATES, EvaluatorOperators::semVerComparison);

    DATETIME_PREDICATES.put("after", new Predicate(dateComparison(delta -> delta >= 0), false));
    DATETIME_PREDICATES.put("before", new Predicate(dateComparison(delta -> delta < 0), false));
  }

  private static void addWithNegation(Map<String, Predicate> map, String name, String negatedName, OperatorFn fn) {
    map.put(name, new Predicate(fn, false));
    map.put(negatedName, new Predicate(fn, true));
  }

  private static void addOrderings(Map<String, Predicate> map, Function<Function<Integer, Boolean>, OperatorFn> comparison) {
    addWithNegation(map, "=", "!=", comparison.apply(delta -> delta == 0));
    map.put(">", new Predicate(comparison.apply(delta -> delta > 0), false));
    map.put(">=", new Predicate(comparison.apply(delta -> delta >= 0), false));
    map.put("<", new Predicate(comparison.apply(delta -> delta < 0), false));
    map.put("<=", new Predicate(comparison.apply(delta -> delta <= 0), false));
  }

  /**
   * Applies a predicate to a user value and a list of objects. Returns false for an unknown
   * condition type or predicate name.
   */
  static boolean apply(ConditionType type, String predicate, String userValue, List<String> objects) {
    Predicate p = predicatesFor(type).get(predicate);
    if (p == null || !isComparable(type, userValue)) {
      return false;
    }
    boolean anyMatch = false;
    for (String object: objects) {
      if (object != null && p.fn.match(userValue, object)) {
        anyMatch = true;
        break;
      }
    }
    return p.negated ? !anyMatch : anyMatch;
  }

  // An unparseable user value fails the condition outright, even for a negated predicate.
  private static boolean isComparable(ConditionType type, String userValue) {
    switch (type) {
    case NUMBER:
      return stringToNumber(userValue) != null;
    case SEMVER:
      return stringToSemVer(userValue) != null;
    case DATETIME:
      return stringToTimestamp(userValue) != null;
    default:
      return userValue != null;
    }
  }

  private static Map<String, Predicate> predicatesFor(ConditionType type) {
    if (type == null) {
      return Collections.emptyMap();
    }
    switch (type) {
    case STRING:
      return STRING_PREDICATES;
    case NUMBER:
      return NUMBER_PREDICATES;
    case SEMVER:
      return SEMVER_PREDICATES;
    case DATETIME:
      return DATETIME_PREDICATES;
    default:
      return Collections.emptyMap();
    }
  }

  static boolean applyRegex(String userValue, String object) {
    Pattern pattern = stringToRegex(object);
    return pattern != null && pattern.matcher(userValue).find();
  }

  static OperatorFn numericComparison(Function<Integer, Boolean> comparisonTest) {
    return (userValue, object) -> {
      Double n1 = stringToNumber(userValue);
      Double n2 = stringToNumber(object);
      if (n1 == null || n2 == null) {
        return false;
      }
      return comparisonTest.apply(Double.compare(n1, n2));
    };
  }

  static OperatorFn dateComparison(Function<Integer, Boolean> comparisonTest) {
    return (userValue, object) -> {
      Long t1 = stringToTimestamp(userValue);
      Long t2 = stringToTimestamp(object);
      if (t1 == null || t2 == null) {
        return false;
      }
      return comparisonTest.apply(Long.compare(t1, t2));
    };
  }

  static OperatorFn semVerComparison(Function<Integer, Boolean> comparisonTest) {
    return (userValue, object) -> {
      SemanticVersion v1 = stringToSemVer(userValue);
      SemanticVersion v2 = stringToSemVer(object);
      if (v1 == null || v2 == null) {
        return false;
      }
      return comparisonTest.apply(v1.compareTo(v2));
    };
  }
}
