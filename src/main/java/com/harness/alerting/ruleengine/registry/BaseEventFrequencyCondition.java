package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ComparisonType;
import com.harness.alerting.ratequery.UniqueConditionQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared threshold logic for the frequency conditions.
 *
 * <p>With {@code comparisonType=count} the condition passes when the current window value is
 * strictly greater than {@code value}. With {@code percent} it passes when the increase over the
 * same window shifted back by {@code comparisonInterval} is strictly greater than {@code value}
 * percent. An empty comparison window counts as no increase.
 */
public abstract class BaseEventFrequencyCondition implements FrequencyConditionHandler {

  protected abstract String queryKind();

  @Override
  public void validate(Map<String, Object> params) {
    FrequencyParams.parse(params);
  }

  @Override
  public List<UniqueConditionQuery> uniqueQueries(Map<String, Object> params, String environment) {
    FrequencyParams p = FrequencyParams.parse(params);
    List<UniqueConditionQuery> queries = new ArrayList<>(2);
    queries.add(new UniqueConditionQuery(queryKind(), p.interval(), environment, null));
    if (p.comparisonType() == ComparisonType.PERCENT) {
      queries.add(new UniqueConditionQuery(queryKind(), p.interval(), environment, p.comparisonInterval()));
    }
    return queries;
  }

  @Override
  public boolean passes(Map<String, Object> params, List<Double> values) {
    FrequencyParams p = FrequencyParams.parse(params);
    if (values.isEmpty()) {
      return false;
    }
    double current = values.get(0);
    if (p.comparisonType() == ComparisonType.COUNT) {
      return current > p.value();
    }
    if (values.size() < 2) {
      return false;
    }
    return percentIncrease(current, values.get(1)) > p.value();
  }

  static double percentIncrease(double current, double previous) {
    if (previous <= 0) {
      return 0.0;
    }
    return (current - previous) / previous * 100.0;
  }
}
