package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ConditionFamily;
import com.harness.alerting.ratequery.UniqueConditionQuery;
import java.util.List;
import java.util.Map;

/**
 * Slow condition answered from bulk aggregate queries during delayed processing.
 */
public interface FrequencyConditionHandler extends ConditionHandler {

  @Override
  default ConditionFamily family() {
    return ConditionFamily.CONDITION;
  }

  @Override
  default boolean isFast() {
    return false;
  }

  /**
   * Queries whose results this condition needs, in the order {@link #passes} expects the
   * values. Count comparisons need one query, percent comparisons two.
   */
  List<UniqueConditionQuery> uniqueQueries(Map<String, Object> params, String environment);

  boolean passes(Map<String, Object> params, List<Double> values);
}
