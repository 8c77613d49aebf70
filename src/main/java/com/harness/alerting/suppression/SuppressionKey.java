package com.harness.alerting.suppression;

import java.util.UUID;

record SuppressionKey(UUID ruleId, long subjectId) {}
