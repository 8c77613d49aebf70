package com.harness.alerting.ruleengine.delayed;

import com.harness.alerting.buffer.BufferPayload;
import com.harness.alerting.model.ConditionSpec;
import com.harness.alerting.model.RuleDto;
import java.util.List;
import java.util.Map;

record ConditionGroupWork(RuleDto rule, List<ConditionSpec> slowConditions, Map<Long, BufferPayload> subjects) {}
