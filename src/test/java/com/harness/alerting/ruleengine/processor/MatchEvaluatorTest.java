package com.harness.alerting.ruleengine.processor;

import com.harness.alerting.enums.MatchMode;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MatchEvaluatorTest {

  @Test
  void allRequiresEveryResult() {
    assertThat(MatchEvaluator.apply(MatchMode.ALL, List.of(true, true))).isTrue();
    assertThat(MatchEvaluator.apply(MatchMode.ALL, List.of(true, false))).isFalse();
  }

  @Test
  void anyRequiresOneResult() {
    assertThat(MatchEvaluator.apply(MatchMode.ANY, List.of(false, true))).isTrue();
    assertThat(MatchEvaluator.apply(MatchMode.ANY, List.of(false, false))).isFalse();
  }

  @Test
  void noneRejectsAnyPassingResult() {
    assertThat(MatchEvaluator.apply(MatchMode.NONE, List.of(false, false))).isTrue();
    assertThat(MatchEvaluator.apply(MatchMode.NONE, List.of(false, true))).isFalse();
  }

  @Test
  void emptyResults() {
    assertThat(MatchEvaluator.apply(MatchMode.ALL, List.of())).isTrue();
    assertThat(MatchEvaluator.apply(MatchMode.ANY, List.of())).isFalse();
    assertThat(MatchEvaluator.apply(MatchMode.NONE, List.of())).isTrue();
  }
}
