package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.MatchOperator;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class AttributeMatcher {

  public boolean matches(MatchOperator op, String actualValue, String expectedValue) {
    if (op == MatchOperator.IS_SET) {
      return actualValue != null && !actualValue.isEmpty();
    }
    if (op == MatchOperator.NOT_SET) {
      return actualValue == null || actualValue.isEmpty();
    }
    if (actualValue == null || expectedValue == null) {
      return false;
    }

    String actual = actualValue.toLowerCase(Locale.ROOT);
    String expected = expectedValue.toLowerCase(Locale.ROOT);
    return switch (op) {
      case EQUALS -> Objects.equals(actual, expected);
      case NOT_EQUALS -> !Objects.equals(actual, expected);
      case CONTAINS -> actual.contains(expected);
      case NOT_CONTAINS -> !actual.contains(expected);
      case STARTS_WITH -> actual.startsWith(expected);
      case ENDS_WITH -> actual.endsWith(expected);
      case REGEX_MATCH -> matchesRegex(actualValue, expectedValue);
      case IS_SET, NOT_SET -> throw new IllegalStateException("handled above");
    };
  }

  private boolean matchesRegex(String actual, String pattern) {
    try {
      return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(actual).find();
    } catch (PatternSyntaxException ex) {
      return false;
    }
  }
}
