package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ConditionFamily;
import com.harness.alerting.enums.MatchOperator;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.EventState;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class TaggedEventFilter implements EventConditionHandler {

  private final AttributeMatcher matcher = new AttributeMatcher();

  @Override
  public String kind() {
    return "tagged_event";
  }

  @Override
  public ConditionFamily family() {
    return ConditionFamily.FILTER;
  }

  @Override
  public boolean passes(AlertEvent event, Map<String, Object> params, EventState state) {
    String key = ConditionParams.requiredString(params, "key");
    MatchOperator op = MatchOperator.fromCode(ConditionParams.string(params, "match"));
    String actual = event.tags() != null ? event.tags().get(key) : null;
    return matcher.matches(op, actual, ConditionParams.string(params, "value"));
  }
}
