package com.harness.alerting.model;

import java.time.Instant;
import java.util.Map;

public record AlertEvent(
    String eventId,
    long projectId,
    Subject subject,
    String environment,
    String level,
    String message,
    String platform,
    String userId,
    Map<String, String> tags,
    String occurrenceId,
    Instant timestamp,
    Instant receivedAt
) {

  public long subjectId() {
    return subject.id();
  }

  public AlertEvent withSubject(Subject other) {
    return new AlertEvent(eventId, projectId, other, environment, level, message, platform,
        userId, tags, occurrenceId, timestamp, receivedAt);
  }
}
