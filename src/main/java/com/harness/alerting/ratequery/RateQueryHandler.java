package com.harness.alerting.ratequery;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Answers a windowed aggregate per subject in one bulk call.
 */
public interface RateQueryHandler {

  String kind();

  /**
   * @param duration           window length
   * @param subjectIds         subjects to report on
   * @param environment        environment name, or {@code null} for all
   * @param now                end of the current window
   * @param comparisonInterval when set, the window is shifted back by this amount
   * @return value per subject; subjects without data map to 0
   */
  Map<Long, Double> getRatesBulk(Duration duration,
                                 Set<Long> subjectIds,
                                 String environment,
                                 Instant now,
                                 Duration comparisonInterval) throws Exception;
}
