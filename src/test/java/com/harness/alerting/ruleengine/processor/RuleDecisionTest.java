package com.harness.alerting.ruleengine.processor;

import com.harness.alerting.enums.MatchMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleDecisionTest {

  @Test
  void fastPassWithoutSlowConditionsFires() {
    assertThat(RuleDecision.of(MatchMode.ALL, true, false)).isEqualTo(RuleDecision.FIRE);
  }

  @Test
  void fastPassWithSlowConditionsDefers() {
    assertThat(RuleDecision.of(MatchMode.ALL, true, true)).isEqualTo(RuleDecision.DEFER);
    assertThat(RuleDecision.of(MatchMode.ANY, true, true)).isEqualTo(RuleDecision.DEFER);
  }

  @Test
  void fastFailUnderAnyIsRescuedBySlowConditions() {
    assertThat(RuleDecision.of(MatchMode.ANY, false, true)).isEqualTo(RuleDecision.DEFER);
    assertThat(RuleDecision.of(MatchMode.ANY, false, false)).isEqualTo(RuleDecision.REJECT);
  }

  @Test
  void fastFailUnderAllOrNoneRejects() {
    assertThat(RuleDecision.of(MatchMode.ALL, false, true)).isEqualTo(RuleDecision.REJECT);
    assertThat(RuleDecision.of(MatchMode.NONE, false, true)).isEqualTo(RuleDecision.REJECT);
  }
}
