package com.harness.alerting.ruleengine.action;

import com.harness.alerting.model.ActionSpec;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import java.util.List;
import java.util.Map;

public interface ActionHandler {

  String kind();

  /**
   * Futures to run because {@code rule} fired for {@code event}. Must not perform the side
   * effect itself.
   */
  List<ActionFuture> after(AlertEvent event, RuleDto rule, ActionSpec action);

  /**
   * @throws IllegalArgumentException if the parameters are invalid
   */
  default void validate(Map<String, Object> params) {
  }
}
