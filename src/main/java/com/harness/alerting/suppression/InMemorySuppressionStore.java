package com.harness.alerting.suppression;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "alerting.suppression.mode", havingValue = "memory")
public class InMemorySuppressionStore implements SuppressionStore {

  private final Map<SuppressionKey, SuppressionRecord> records = new ConcurrentHashMap<>();

  @Override
  public Map<UUID, SuppressionRecord> getOrCreate(Collection<UUID> ruleIds, long subjectId) {
    Map<UUID, SuppressionRecord> result = new HashMap<>();
    for (UUID ruleId : ruleIds) {
      SuppressionRecord record = records.computeIfAbsent(
          new SuppressionKey(ruleId, subjectId),
          key -> new SuppressionRecord(ruleId, subjectId, null));
      result.put(ruleId, record);
    }
    return result;
  }

  @Override
  public boolean tryFire(UUID ruleId, long subjectId, Instant now, Duration cooldown) {
    AtomicBoolean fired = new AtomicBoolean(false);
    records.compute(new SuppressionKey(ruleId, subjectId), (key, existing) -> {
      if (existing != null && existing.isCoolingDown(now, cooldown)) {
        return existing;
      }
      fired.set(true);
      return new SuppressionRecord(ruleId, subjectId, now);
    });
    return fired.get();
  }
}
