package com.harness.alerting.enums;

import java.util.Locale;
import java.util.Optional;

public enum MatchMode {
  ALL,
  ANY,
  NONE;

  public static Optional<MatchMode> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(MatchMode.valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
