package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ComparisonType;
import com.harness.alerting.ratequery.RateWindows;
import java.util.Map;

record FrequencyParams(String interval, double value, ComparisonType comparisonType, String comparisonInterval) {

  static FrequencyParams parse(Map<String, Object> params) {
    String interval = ConditionParams.requiredString(params, "interval");
    RateWindows.interval(interval);

    double value = Math.max(0.0, ConditionParams.number(params, "value"));
    ComparisonType comparisonType = ComparisonType.fromValue(params.get("comparisonType"));

    String comparisonInterval = null;
    if (comparisonType == ComparisonType.PERCENT) {
      comparisonInterval = ConditionParams.requiredString(params, "comparisonInterval");
      RateWindows.comparisonInterval(comparisonInterval);
    }
    return new FrequencyParams(interval, value, comparisonType, comparisonInterval);
  }
}
