package com.harness.alerting.ruleengine.delayed;

import com.harness.alerting.buffer.BufferPayload;
import com.harness.alerting.enums.MatchMode;
import com.harness.alerting.model.ConditionSpec;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.ratequery.UniqueConditionQuery;
import com.harness.alerting.ruleengine.registry.ConditionRegistry;
import com.harness.alerting.ruleengine.registry.EventFrequencyCondition;
import com.harness.alerting.ruleengine.registry.EventUniqueUserFrequencyCondition;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class UniqueQueryPlannerTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private final UniqueQueryPlanner planner = new UniqueQueryPlanner(new ConditionRegistry(List.of(
      new EventFrequencyCondition(),
      new EventUniqueUserFrequencyCondition()
  )));

  @Test
  void countConditionNeedsOneQuery() {
    ConditionSpec count = new ConditionSpec("event_frequency", Map.of("interval", "1h", "value", 10));

    assertThat(planner.queriesFor(count, "production"))
        .containsExactly(new UniqueConditionQuery("event_frequency", "1h", "production", null));
  }

  @Test
  void percentConditionNeedsCurrentAndComparisonWindow() {
    ConditionSpec percent = new ConditionSpec("event_frequency", Map.of(
        "interval", "1h", "value", 50, "comparisonType", "percent", "comparisonInterval", "1d"));

    assertThat(planner.queriesFor(percent, null)).containsExactly(
        new UniqueConditionQuery("event_frequency", "1h", null, null),
        new UniqueConditionQuery("event_frequency", "1h", null, "1d"));
  }

  @Test
  void countAndPercentConditionsShareTheCurrentWindowQuery() {
    RuleDto countRule = rule(new ConditionSpec("event_frequency", Map.of("interval", "1h", "value", 10)));
    RuleDto percentRule = rule(new ConditionSpec("event_frequency", Map.of(
        "interval", "1h", "value", 50, "comparisonType", "percent", "comparisonInterval", "1d")));

    Map<UniqueConditionQuery, SubjectQueryParams> plan = planner.plan(List.of(
        work(countRule, Map.of(1L, payload(NOW.minusSeconds(60)))),
        work(percentRule, Map.of(2L, payload(NOW.minusSeconds(10))))
    ));

    assertThat(plan).hasSize(2);
    SubjectQueryParams current = plan.get(new UniqueConditionQuery("event_frequency", "1h", null, null));
    assertThat(current.subjectIds()).containsExactlyInAnyOrder(1L, 2L);
    assertThat(current.anchorOr(NOW)).isEqualTo(NOW.minusSeconds(10));
    SubjectQueryParams comparison = plan.get(new UniqueConditionQuery("event_frequency", "1h", null, "1d"));
    assertThat(comparison.subjectIds()).containsExactly(2L);
  }

  @Test
  void differentHandlersAndIntervalsAreSeparateQueries() {
    RuleDto rule = rule(
        new ConditionSpec("event_frequency", Map.of("interval", "1h", "value", 10)),
        new ConditionSpec("event_frequency", Map.of("interval", "1d", "value", 10)),
        new ConditionSpec("event_unique_user_frequency", Map.of("interval", "1h", "value", 10)));

    Map<UniqueConditionQuery, SubjectQueryParams> plan =
        planner.plan(List.of(work(rule, Map.of(1L, payload(NOW)))));

    assertThat(plan.keySet()).extracting(UniqueConditionQuery::handlerKind, UniqueConditionQuery::interval)
        .containsExactlyInAnyOrder(
            tuple("event_frequency", "1h"),
            tuple("event_frequency", "1d"),
            tuple("event_unique_user_frequency", "1h"));
  }

  @Test
  void invalidOrUnknownConditionsPlanNothing() {
    ConditionSpec badInterval = new ConditionSpec("event_frequency", Map.of("interval", "3h", "value", 10));
    ConditionSpec unknown = new ConditionSpec("event_frequency_v2", Map.of("interval", "1h", "value", 10));

    assertThat(planner.queriesFor(badInterval, null)).isEmpty();
    assertThat(planner.queriesFor(unknown, null)).isEmpty();
    assertThat(planner.frequencyHandler(unknown)).isEmpty();
  }

  @Test
  void anchorFallsBackWhenNoTimestampWasBuffered() {
    RuleDto rule = rule(new ConditionSpec("event_frequency", Map.of("interval", "1h", "value", 10)));

    Map<UniqueConditionQuery, SubjectQueryParams> plan =
        planner.plan(List.of(work(rule, Map.of(1L, payload(null)))));

    assertThat(plan.values()).singleElement()
        .satisfies(params -> assertThat(params.anchorOr(NOW)).isEqualTo(NOW));
  }

  private ConditionGroupWork work(RuleDto rule, Map<Long, BufferPayload> subjects) {
    return new ConditionGroupWork(rule, rule.conditions(), subjects);
  }

  private BufferPayload payload(Instant timestamp) {
    return new BufferPayload(UUID.randomUUID().toString(), null, timestamp);
  }

  private RuleDto rule(ConditionSpec... conditions) {
    return new RuleDto(UUID.randomUUID(), 1L, "rule", null, true, false, MatchMode.ALL, MatchMode.ALL, 60,
        List.of(conditions), List.of(), NOW, NOW);
  }
}
