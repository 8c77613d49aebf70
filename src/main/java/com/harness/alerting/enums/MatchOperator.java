package com.harness.alerting.enums;

import java.util.Arrays;
import java.util.Locale;

public enum MatchOperator {
  EQUALS("eq"),
  NOT_EQUALS("ne"),
  CONTAINS("co"),
  NOT_CONTAINS("nc"),
  STARTS_WITH("sw"),
  ENDS_WITH("ew"),
  REGEX_MATCH("re"),
  IS_SET("is"),
  NOT_SET("ns");

  private final String code;

  MatchOperator(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static MatchOperator fromCode(String code) {
    if (code == null) {
      throw new IllegalArgumentException("match operator is required");
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(op -> op.code.equals(normalized) || op.name().equalsIgnoreCase(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown match operator: " + code));
  }
}
