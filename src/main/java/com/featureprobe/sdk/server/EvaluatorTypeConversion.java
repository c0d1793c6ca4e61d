package com.featureprobe.sdk.server;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses condition operands and user attribute values. Each method returns null for input it
 * cannot interpret, which makes the comparison fail instead of raising an error.
 */
abstract class EvaluatorTypeConversion {
  private EvaluatorTypeConversion() {}

  static Double stringToNumber(String s) {
    if (s == null) {
      return null;
    }
    try {
      double d = Double.parseDouble(s.trim());
      return Double.isNaN(d) ? null : d;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  // Unix timestamps in seconds
  static Long stringToTimestamp(String s) {
    if (s == null) {
      return null;
    }
    try {
      return Long.parseLong(s.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static SemanticVersion stringToSemVer(String s) {
    if (s == null) {
      return null;
    }
    try {
      return SemanticVersion.parse(s.trim(), true);
    } catch (SemanticVersion.InvalidVersionException e) {
      return null;
    }
  }

  static Pattern stringToRegex(String s) {
    if (s == null) {
      return null;
    }
    try {
      return Pattern.compile(s);
    } catch (PatternSyntaxException e) {
      return null;
    }
  }
}
