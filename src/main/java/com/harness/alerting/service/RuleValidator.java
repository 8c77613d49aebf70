package com.harness.alerting.service;

import com.harness.alerting.model.ActionSpec;
import com.harness.alerting.model.ConditionSpec;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.ruleengine.action.ActionHandler;
import com.harness.alerting.ruleengine.action.ActionRegistry;
import com.harness.alerting.ruleengine.registry.ConditionHandler;
import com.harness.alerting.ruleengine.registry.ConditionRegistry;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class RuleValidator {

  private final ConditionRegistry conditionRegistry;
  private final ActionRegistry actionRegistry;

  public RuleValidator(ConditionRegistry conditionRegistry, ActionRegistry actionRegistry) {
    this.conditionRegistry = conditionRegistry;
    this.actionRegistry = actionRegistry;
  }

  public void validate(RuleDto rule) {
    if (rule.name() == null || rule.name().isBlank()) {
      throw new IllegalArgumentException("Rule name is required");
    }
    if (rule.actionMatch() == null) {
      throw new IllegalArgumentException("actionMatch must be one of ALL, ANY, NONE");
    }
    if (rule.frequencyMinutes() < 1) {
      throw new IllegalArgumentException("frequencyMinutes must be at least 1");
    }

    List<ConditionSpec> conditions = rule.conditions() == null ? List.of() : rule.conditions();
    for (ConditionSpec condition : conditions) {
      if (condition == null || condition.kind() == null) {
        throw new IllegalArgumentException("Condition kind is required");
      }
      ConditionHandler handler = conditionRegistry.lookup(condition.kind())
          .orElseThrow(() -> new IllegalArgumentException("Unknown condition kind: " + condition.kind()));
      handler.validate(condition.params());
    }

    List<ActionSpec> actions = rule.actions() == null ? List.of() : rule.actions();
    for (ActionSpec action : actions) {
      if (action == null || action.kind() == null) {
        throw new IllegalArgumentException("Action kind is required");
      }
      ActionHandler handler = actionRegistry.lookup(action.kind())
          .orElseThrow(() -> new IllegalArgumentException("Unknown action kind: " + action.kind()));
      handler.validate(action.params());
    }
  }
}
