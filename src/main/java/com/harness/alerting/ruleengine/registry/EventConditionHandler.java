package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.EventState;
import java.util.Map;

/**
 * Fast condition or filter evaluated inline against a single event.
 */
public interface EventConditionHandler extends ConditionHandler {

  @Override
  default boolean isFast() {
    return true;
  }

  boolean passes(AlertEvent event, Map<String, Object> params, EventState state);
}
