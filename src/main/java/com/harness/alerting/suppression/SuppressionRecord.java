package com.harness.alerting.suppression;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record SuppressionRecord(UUID ruleId, long subjectId, Instant lastActive) {

  public boolean isCoolingDown(Instant now, Duration cooldown) {
    return lastActive != null && lastActive.isAfter(now.minus(cooldown));
  }
}
