package com.harness.alerting.ratequery;

public record UniqueConditionQuery(
    String handlerKind,
    String interval,
    String environment,
    String comparisonInterval
) {
}
