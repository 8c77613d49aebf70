package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ConditionFamily;
import com.harness.alerting.enums.MatchOperator;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.EventState;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class EventAttributeFilter implements EventConditionHandler {

  private final AttributeMatcher matcher = new AttributeMatcher();

  @Override
  public String kind() {
    return "event_attribute";
  }

  @Override
  public ConditionFamily family() {
    return ConditionFamily.FILTER;
  }

  @Override
  public boolean passes(AlertEvent event, Map<String, Object> params, EventState state) {
    String attribute = ConditionParams.requiredString(params, "attribute");
    MatchOperator op = MatchOperator.fromCode(ConditionParams.string(params, "match"));
    return matcher.matches(op, extract(event, attribute), ConditionParams.string(params, "value"));
  }

  String extract(AlertEvent event, String attribute) {
    return switch (attribute.toLowerCase(Locale.ROOT)) {
      case "message" -> event.message();
      case "level" -> event.level();
      case "environment" -> event.environment();
      case "platform" -> event.platform();
      case "user", "user.id" -> event.userId();
      default -> throw new IllegalArgumentException("Unsupported event attribute: " + attribute);
    };
  }
}
