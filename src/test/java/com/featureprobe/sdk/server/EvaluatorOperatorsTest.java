package com.featureprobe.sdk.server;

import com.featureprobe.sdk.server.DataModel.ConditionType;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class EvaluatorOperatorsTest {
  private static boolean apply(ConditionType type, String predicate, String userValue, String... objects) {
    return EvaluatorOperators.apply(type, predicate, userValue, Arrays.asList(objects));
  }

  @Test
  public void stringPredicates() {
    assertTrue(apply(ConditionType.STRING, "is one of", "b", "a", "b"));
    assertFalse(apply(ConditionType.STRING, "is one of", "c", "a", "b"));
    assertTrue(apply(ConditionType.STRING, "starts with", "featureprobe", "feature"));
    assertTrue(apply(ConditionType.STRING, "ends with", "featureprobe", "x", "probe"));
    assertTrue(apply(ConditionType.STRING, "contains", "featureprobe", "turep"));
    assertTrue(apply(ConditionType.STRING, "matches regex", "user-123", "^user-\\d+$"));
    assertTrue(apply(ConditionType.STRING, "matches regex", "the user-123 here", "user-\\d+"));
  }

  @Test
  public void negatedStringPredicatesRequireNoObjectToMatch() {
    assertTrue(apply(ConditionType.STRING, "is not any of", "c", "a", "b"));
    assertFalse(apply(ConditionType.STRING, "is not any of", "b", "a", "b"));
    assertTrue(apply(ConditionType.STRING, "does not start with", "probe", "feature"));
    assertFalse(apply(ConditionType.STRING, "does not end with", "featureprobe", "probe"));
    assertFalse(apply(ConditionType.STRING, "does not contain", "featureprobe", "x", "eat"));
    assertTrue(apply(ConditionType.STRING, "does not match regex", "abc", "^\\d+$"));
  }

  @Test
  public void invalidRegexDoesNotMatch() {
    assertFalse(apply(ConditionType.STRING, "matches regex", "abc", "(unclosed"));
  }

  @Test
  public void emptyObjectList() {
    assertFalse(apply(ConditionType.STRING, "is one of", "a"));
    assertTrue(apply(ConditionType.STRING, "is not any of", "a"));
  }

  @Test
  public void numberPredicates() {
    assertTrue(apply(ConditionType.NUMBER, "=", "10", "1", "10.0"));
    assertTrue(apply(ConditionType.NUMBER, "!=", "10", "1", "2"));
    assertFalse(apply(ConditionType.NUMBER, "!=", "10", "10"));
    assertTrue(apply(ConditionType.NUMBER, ">", "10", "9.5"));
    assertFalse(apply(ConditionType.NUMBER, ">", "10", "10"));
    assertTrue(apply(ConditionType.NUMBER, ">=", "10", "10"));
    assertTrue(apply(ConditionType.NUMBER, "<", "-1", "0"));
    assertTrue(apply(ConditionType.NUMBER, "<=", " 3 ", "3"));
  }

  @Test
  public void unparseableUserNumberFailsEvenWhenNegated() {
    assertFalse(apply(ConditionType.NUMBER, "=", "ten", "10"));
    assertFalse(apply(ConditionType.NUMBER, "!=", "ten", "10"));
  }

  @Test
  public void unparseableObjectIsSkipped() {
    assertTrue(apply(ConditionType.NUMBER, "=", "10", "ten", "10"));
    assertFalse(apply(ConditionType.NUMBER, "<", "10", "ten"));
  }

  @Test
  public void semverPredicates() {
    assertTrue(apply(ConditionType.SEMVER, "=", "1.2.3", "1.2.3"));
    assertTrue(apply(ConditionType.SEMVER, "=", "1.2", "1.2.0"));
    assertTrue(apply(ConditionType.SEMVER, "<", "1.2.3-beta", "1.2.3"));
    assertTrue(apply(ConditionType.SEMVER, ">", "1.10.0", "1.9.9"));
    assertTrue(apply(ConditionType.SEMVER, "!=", "2.0.0", "1.0.0"));
    assertFalse(apply(ConditionType.SEMVER, "!=", "not-a-version", "1.0.0"));
  }

  @Test
  public void datetimePredicates() {
    assertTrue(apply(ConditionType.DATETIME, "after", "1000", "1000"));
    assertTrue(apply(ConditionType.DATETIME, "after", "1001", "1000"));
    assertFalse(apply(ConditionType.DATETIME, "before", "1000", "1000"));
    assertTrue(apply(ConditionType.DATETIME, "before", "999", "1000"));
    assertFalse(apply(ConditionType.DATETIME, "before", "yesterday", "1000"));
  }

  @Test
  public void unknownPredicateNeverMatches() {
    assertFalse(apply(ConditionType.STRING, "sounds like", "a", "a"));
    assertFalse(apply(ConditionType.NUMBER, "is one of", "1", "1"));
    assertFalse(apply(null, "is one of", "a", "a"));
  }
}
