package com.featureprobe.sdk.server;

import com.google.common.io.Resources;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

@SuppressWarnings("javadoc")
public class TestUtil {
  public static String resourceJson(String name) {
    try {
      return Resources.toString(Resources.getResource(name), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static String fixtureRepoJson() {
    return resourceJson("fixtures/repo.json");
  }

  public static Repository fixtureRepo() {
    return Repository.fromJson(fixtureRepoJson());
  }
}
