package com.harness.alerting.ruleengine.action;

import com.harness.alerting.model.RuleDto;
import java.util.Map;

public record ActionFuture(
    String key,
    ActionCallback callback,
    RuleDto rule,
    Map<String, Object> kwargs
) {}
