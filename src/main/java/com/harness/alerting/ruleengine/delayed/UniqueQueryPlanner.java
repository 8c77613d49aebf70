package com.harness.alerting.ruleengine.delayed;

import com.harness.alerting.buffer.BufferPayload;
import com.harness.alerting.common.Result;
import com.harness.alerting.model.ConditionSpec;
import com.harness.alerting.ratequery.UniqueConditionQuery;
import com.harness.alerting.ruleengine.registry.ConditionHandler;
import com.harness.alerting.ruleengine.registry.ConditionRegistry;
import com.harness.alerting.ruleengine.registry.FrequencyConditionHandler;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class UniqueQueryPlanner {

  private static final Logger log = LoggerFactory.getLogger(UniqueQueryPlanner.class);

  private final ConditionRegistry conditionRegistry;

  public UniqueQueryPlanner(ConditionRegistry conditionRegistry) {
    this.conditionRegistry = conditionRegistry;
  }

  Map<UniqueConditionQuery, SubjectQueryParams> plan(List<ConditionGroupWork> groups) {
    Map<UniqueConditionQuery, SubjectQueryParams> plan = new LinkedHashMap<>();
    for (ConditionGroupWork group : groups) {
      for (ConditionSpec condition : group.slowConditions()) {
        for (UniqueConditionQuery query : queriesFor(condition, group.rule().environment())) {
          SubjectQueryParams params = plan.computeIfAbsent(query, q -> new SubjectQueryParams());
          for (Map.Entry<Long, BufferPayload> subject : group.subjects().entrySet()) {
            params.add(subject.getKey(), subject.getValue().timestamp());
          }
        }
      }
    }
    log.debug("Planned unique queries: groups={}, queries={}", groups.size(), plan.size());
    return plan;
  }

  List<UniqueConditionQuery> queriesFor(ConditionSpec condition, String environment) {
    Optional<FrequencyConditionHandler> handler = frequencyHandler(condition);
    if (handler.isEmpty()) {
      return List.of();
    }
    return Result.of(() -> handler.get().uniqueQueries(condition.params(), environment))
        .onFailure(e -> log.warn("Invalid slow condition: kind={}, reason={}", condition.kind(), e.getMessage()))
        .getOrElse(List.of());
  }

  Optional<FrequencyConditionHandler> frequencyHandler(ConditionSpec condition) {
    Optional<ConditionHandler> handler = conditionRegistry.lookup(condition.kind());
    if (handler.isPresent() && handler.get() instanceof FrequencyConditionHandler frequency) {
      return Optional.of(frequency);
    }
    return Optional.empty();
  }
}
