package com.harness.alerting.ratequery;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class UniqueUserRateQuery extends DuckDbRateQueryHandler {

  public static final String KIND = "event_unique_user_frequency";

  public UniqueUserRateQuery(RateQueryBuilder queryBuilder,
                             @Value("${alerting.archive.base-path:/tmp/alerting-engine/events}") String basePath) {
    super(queryBuilder, basePath);
  }

  @Override
  public String kind() {
    return KIND;
  }

  @Override
  protected String aggregate() {
    return "COUNT(DISTINCT user_id)";
  }
}
