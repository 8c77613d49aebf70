package com.harness.alerting.enums;

import java.util.Locale;

public enum ComparisonType {
  COUNT,
  PERCENT;

  public static ComparisonType fromValue(Object value) {
    if (value == null) {
      return COUNT;
    }
    return ComparisonType.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
  }
}
