package com.harness.alerting.suppression;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Per (rule, subject) record of the last time the rule fired, shared by every evaluator
 * instance.
 */
public interface SuppressionStore {

  /**
   * Fetch the records for all rules against one subject, creating the missing ones. Concurrent
   * callers creating the same record both succeed and see the same row.
   */
  Map<UUID, SuppressionRecord> getOrCreate(Collection<UUID> ruleIds, long subjectId);

  /**
   * Atomically set {@code lastActive = now} if the rule has never fired for the subject or last
   * fired at or before {@code now - cooldown}.
   *
   * @return {@code true} if this caller won the right to fire
   */
  boolean tryFire(UUID ruleId, long subjectId, Instant now, Duration cooldown);
}
