package com.harness.alerting.ruleengine.processor;

import com.harness.alerting.enums.MatchMode;

public enum RuleDecision {
  REJECT,
  DEFER,
  FIRE;

  public static RuleDecision of(MatchMode actionMatch, boolean fastPassed, boolean hasSlow) {
    if (!fastPassed) {
      return actionMatch == MatchMode.ANY && hasSlow ? DEFER : REJECT;
    }
    return hasSlow ? DEFER : FIRE;
  }
}
