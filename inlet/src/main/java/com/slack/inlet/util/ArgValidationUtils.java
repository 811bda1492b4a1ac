package com.slack.inlet.util;

public class ArgValidationUtils {
  public static void ensureNonEmptyString(String s, String exceptionMessage) {
    if (s == null || s.isEmpty()) {
      throw new IllegalArgumentException(exceptionMessage);
    }
  }

  public static void ensureTrue(boolean condition, String exceptionMessage) {
    if (!condition) {
      throw new IllegalArgumentException(exceptionMessage);
    }
  }

  public static void ensureFraction(double value, String exceptionMessage) {
    if (Double.isNaN(value) || value < 0 || value > 1) {
      throw new IllegalArgumentException(exceptionMessage);
    }
  }
}
