package com.featureprobe.sdk.server;

import com.featureprobe.sdk.FPUser;
import com.featureprobe.sdk.FPValue;
import com.featureprobe.sdk.server.DataModel.Segment;
import com.featureprobe.sdk.server.DataModel.Toggle;

import org.junit.Test;

import java.time.Clock;
import java.util.Map;

import static com.featureprobe.sdk.server.ModelBuilders.rule;
import static com.featureprobe.sdk.server.ModelBuilders.segmentBuilder;
import static com.featureprobe.sdk.server.ModelBuilders.segmentCondition;
import static com.featureprobe.sdk.server.ModelBuilders.segments;
import static com.featureprobe.sdk.server.ModelBuilders.select;
import static com.featureprobe.sdk.server.ModelBuilders.stringCondition;
import static com.featureprobe.sdk.server.ModelBuilders.toggleBuilder;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class EvaluatorSegmentMatchTest {
  private static final Evaluator evaluator = new Evaluator(Clock.systemUTC());

  private static final Segment PARISIANS = segmentBuilder("parisians")
      .rule(stringCondition("city", "is one of", "Paris"))
      .build();
  private static final Segment BETA_USERS = segmentBuilder("beta")
      .rule(stringCondition("group", "is one of", "beta"))
      .rule(stringCondition("email", "ends with", "@featureprobe.com"))
      .build();

  private static final FPUser PARIS_USER = new FPUser.Builder().with("city", "Paris").build();
  private static final FPUser LONDON_USER = new FPUser.Builder().with("city", "London").build();

  private static Toggle segmentToggle(String predicate, String... segmentKeys) {
    return toggleBuilder("seg_toggle")
        .variations(FPValue.of(false), FPValue.of(true))
        .rules(rule(select(1), segmentCondition(predicate, segmentKeys)))
        .defaultServe(select(0))
        .build();
  }

  private static int evalIndex(Toggle toggle, FPUser user, Map<String, Segment> segments) {
    return evaluator.evaluate(toggle, user, segments).getVariationIndex();
  }

  @Test
  public void userInSegmentMatchesIsIn() {
    assertEquals(1, evalIndex(segmentToggle("is in", "parisians"), PARIS_USER, segments(PARISIANS)));
    assertEquals(0, evalIndex(segmentToggle("is in", "parisians"), LONDON_USER, segments(PARISIANS)));
  }

  @Test
  public void userNotInSegmentMatchesIsNotIn() {
    assertEquals(0, evalIndex(segmentToggle("is not in", "parisians"), PARIS_USER, segments(PARISIANS)));
    assertEquals(1, evalIndex(segmentToggle("is not in", "parisians"), LONDON_USER, segments(PARISIANS)));
  }

  @Test
  public void anyListedSegmentIsEnough() {
    FPUser betaUser = new FPUser.Builder().with("city", "London").with("group", "beta").build();
    Toggle toggle = segmentToggle("is in", "parisians", "beta");
    assertEquals(1, evalIndex(toggle, betaUser, segments(PARISIANS, BETA_USERS)));
    assertEquals(1, evalIndex(toggle, PARIS_USER, segments(PARISIANS, BETA_USERS)));
  }

  @Test
  public void segmentRulesAreOred() {
    FPUser staff = new FPUser.Builder().with("email", "dev@featureprobe.com").build();
    assertEquals(1, evalIndex(segmentToggle("is in", "beta"), staff, segments(BETA_USERS)));
  }

  @Test
  public void unknownSegmentDoesNotContainUser() {
    assertEquals(0, evalIndex(segmentToggle("is in", "nowhere"), PARIS_USER, segments(PARISIANS)));
    assertEquals(1, evalIndex(segmentToggle("is not in", "nowhere"), PARIS_USER, segments(PARISIANS)));
  }

  @Test
  public void unknownSegmentPredicateNeverMatches() {
    assertEquals(0, evalIndex(segmentToggle("is maybe in", "parisians"), PARIS_USER, segments(PARISIANS)));
  }

  @Test
  public void segmentCanReferenceAnotherSegment() {
    Segment outer = segmentBuilder("outer").rule(segmentCondition("is in", "parisians")).build();
    assertEquals(1, evalIndex(segmentToggle("is in", "outer"), PARIS_USER, segments(outer, PARISIANS)));
    assertEquals(0, evalIndex(segmentToggle("is in", "outer"), LONDON_USER, segments(outer, PARISIANS)));
  }

  @Test
  public void segmentCycleUsesCallerDefault() {
    Segment a = segmentBuilder("a").rule(segmentCondition("is in", "b")).build();
    Segment b = segmentBuilder("b").rule(segmentCondition("is in", "a")).build();
    EvalResult result = evaluator.evaluate(segmentToggle("is in", "a"), PARIS_USER, segments(a, b));
    assertTrue(result.isDefault());
    assertThat(result.getReason(), containsString("references itself"));
  }
}
