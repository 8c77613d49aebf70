package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ConditionFamily;
import java.util.Map;

/**
 * A registered condition or filter kind. Implementations are stateless and shared across
 * worker threads.
 */
public interface ConditionHandler {

  String kind();

  ConditionFamily family();

  /**
   * Fast handlers are a pure function of the event; slow ones need a windowed aggregate.
   */
  boolean isFast();

  /**
   * Reject parameters this handler can never evaluate. Called when a rule is saved.
   *
   * @throws IllegalArgumentException if the parameters are invalid
   */
  default void validate(Map<String, Object> params) {
  }
}
