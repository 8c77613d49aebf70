package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ConditionFamily;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.EventState;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class LevelFilter implements EventConditionHandler {

  private static final List<String> LEVELS = List.of("debug", "info", "warning", "error", "fatal");

  @Override
  public String kind() {
    return "level";
  }

  @Override
  public ConditionFamily family() {
    return ConditionFamily.FILTER;
  }

  @Override
  public void validate(Map<String, Object> params) {
    rank(ConditionParams.requiredString(params, "level"));
    String match = ConditionParams.requiredString(params, "match").toLowerCase(Locale.ROOT);
    if (!List.of("eq", "gte", "lte").contains(match)) {
      throw new IllegalArgumentException("Unsupported level match: " + match);
    }
  }

  @Override
  public boolean passes(AlertEvent event, Map<String, Object> params, EventState state) {
    int expected = rank(ConditionParams.requiredString(params, "level"));
    if (event.level() == null) {
      return false;
    }
    int actual = rank(event.level());
    String match = ConditionParams.requiredString(params, "match").toLowerCase(Locale.ROOT);
    return switch (match) {
      case "eq" -> actual == expected;
      case "gte" -> actual >= expected;
      case "lte" -> actual <= expected;
      default -> throw new IllegalArgumentException("Unsupported level match: " + match);
    };
  }

  private int rank(String level) {
    int idx = LEVELS.indexOf(level.toLowerCase(Locale.ROOT));
    if (idx < 0) {
      throw new IllegalArgumentException("Unknown level: " + level);
    }
    return idx;
  }
}
