package com.harness.alerting.notification;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record NotificationRecord(
    String id,
    Instant timestamp,
    String channel,
    long projectId,
    long subjectId,
    List<String> ruleNames,
    String message,
    Map<String, Object> details
) {}
