package com.harness.alerting.ruleengine.processor;

import com.harness.alerting.enums.MatchMode;
import java.util.List;

public final class MatchEvaluator {

  private MatchEvaluator() {
  }

  public static boolean apply(MatchMode mode, List<Boolean> results) {
    return switch (mode) {
      case ALL -> results.stream().allMatch(Boolean::booleanValue);
      case ANY -> results.stream().anyMatch(Boolean::booleanValue);
      case NONE -> results.stream().noneMatch(Boolean::booleanValue);
    };
  }
}
