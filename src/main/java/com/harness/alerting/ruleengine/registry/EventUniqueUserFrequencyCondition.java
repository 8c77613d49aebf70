package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.ratequery.UniqueUserRateQuery;
import org.springframework.stereotype.Component;

@Component
public class EventUniqueUserFrequencyCondition extends BaseEventFrequencyCondition {

  @Override
  public String kind() {
    return "event_unique_user_frequency";
  }

  @Override
  protected String queryKind() {
    return UniqueUserRateQuery.KIND;
  }
}
