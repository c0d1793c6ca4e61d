package com.featureprobe.sdk.server;

abstract class Version {
  private Version() {}

  static final String SDK_VERSION = "1.0.0";

  static final String USER_AGENT = "Java/" + SDK_VERSION;
}
