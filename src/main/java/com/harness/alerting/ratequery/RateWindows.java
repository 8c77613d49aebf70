package com.harness.alerting.ratequery;

import java.time.Duration;
import java.util.Map;

public final class RateWindows {

  public static final Map<String, Duration> INTERVALS = Map.of(
      "1m", Duration.ofMinutes(1),
      "5m", Duration.ofMinutes(5),
      "15m", Duration.ofMinutes(15),
      "1h", Duration.ofHours(1),
      "1d", Duration.ofDays(1),
      "1w", Duration.ofDays(7),
      "30d", Duration.ofDays(30)
  );

  public static final Map<String, Duration> COMPARISON_INTERVALS = Map.of(
      "5m", Duration.ofMinutes(5),
      "15m", Duration.ofMinutes(15),
      "1h", Duration.ofHours(1),
      "1d", Duration.ofDays(1),
      "1w", Duration.ofDays(7),
      "30d", Duration.ofDays(30)
  );

  private RateWindows() {
  }

  public static Duration interval(String key) {
    Duration duration = INTERVALS.get(key);
    if (duration == null) {
      throw new IllegalArgumentException("Unsupported interval: " + key);
    }
    return duration;
  }

  public static Duration comparisonInterval(String key) {
    Duration duration = COMPARISON_INTERVALS.get(key);
    if (duration == null) {
      throw new IllegalArgumentException("Unsupported comparison interval: " + key);
    }
    return duration;
  }
}
