package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ConditionFamily;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.EventState;
import java.util.Map;
import java.util.function.Predicate;

public class StateTransitionCondition implements EventConditionHandler {

  private final String kind;
  private final Predicate<EventState> flag;

  public StateTransitionCondition(String kind, Predicate<EventState> flag) {
    this.kind = kind;
    this.flag = flag;
  }

  @Override
  public String kind() {
    return kind;
  }

  @Override
  public ConditionFamily family() {
    return ConditionFamily.CONDITION;
  }

  @Override
  public boolean passes(AlertEvent event, Map<String, Object> params, EventState state) {
    return state != null && flag.test(state);
  }
}
