package com.featureprobe.sdk.server;

import com.featureprobe.sdk.server.DataModel.Segment;
import com.featureprobe.sdk.server.DataModel.Toggle;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * An immutable snapshot of every toggle and segment known to the SDK.
 * <p>
 * A snapshot is never modified after construction; a newer one replaces it as a whole (see
 * {@link RepositoryStore}), so an evaluation always sees one consistent version of the data.
 */
public final class Repository {
  private static final Repository EMPTY = new Repository(
      ImmutableMap.<String, Toggle>of(), ImmutableMap.<String, Segment>of());

  private final ImmutableMap<String, Toggle> toggles;
  private final ImmutableMap<String, Segment> segments;

  Repository(Map<String, Toggle> toggles, Map<String, Segment> segments) {
    this.toggles = ImmutableMap.copyOf(toggles);
    this.segments = ImmutableMap.copyOf(segments);
  }

  /**
   * Returns a snapshot with no toggles and no segments.
   *
   * @return the empty snapshot
   */
  public static Repository empty() {
    return EMPTY;
  }

  /**
   * Parses a snapshot in the format returned by the FeatureProbe toggles endpoint.
   *
   * @param json the JSON document
   * @return the parsed snapshot
   * @throws SerializationException if the document is malformed
   */
  public static Repository fromJson(String json) throws SerializationException {
    return DataModelSerialization.parseRepository(json);
  }

  /**
   * Returns the keys of all toggles in this snapshot.
   *
   * @return the toggle keys
   */
  public Set<String> getToggleKeys() {
    return toggles.keySet();
  }

  /**
   * Returns the keys of all segments in this snapshot.
   *
   * @return the segment keys
   */
  public Set<String> getSegmentKeys() {
    return segments.keySet();
  }

  /**
   * Tests whether this snapshot holds no data.
   *
   * @return true if there are no toggles and no segments
   */
  public boolean isEmpty() {
    return toggles.isEmpty() && segments.isEmpty();
  }

  @Nullable
  Toggle getToggle(String key) {
    return key == null ? null : toggles.get(key);
  }

  Map<String, Segment> getSegments() {
    return segments;
  }

  @Override
  public String toString() {
    return "Repository(toggles=" + toggles.keySet() + ",segments=" + segments.keySet() + ")";
  }
}
