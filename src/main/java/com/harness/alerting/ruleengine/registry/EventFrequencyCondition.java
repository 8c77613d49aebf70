package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.ratequery.EventFrequencyRateQuery;
import org.springframework.stereotype.Component;

@Component
public class EventFrequencyCondition extends BaseEventFrequencyCondition {

  @Override
  public String kind() {
    return "event_frequency";
  }

  @Override
  protected String queryKind() {
    return EventFrequencyRateQuery.KIND;
  }
}
