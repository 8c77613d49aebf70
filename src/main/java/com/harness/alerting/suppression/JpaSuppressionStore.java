package com.harness.alerting.suppression;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.harness.alerting.repository.SuppressionRecordEntity;
import com.harness.alerting.repository.SuppressionRecordRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed store. The unique (rule_id, subject_id) constraint makes creation race-safe
 * and the conditional update in {@link #tryFire} makes firing race-safe across instances.
 * Reads go through a bounded Caffeine cache; the cache is only used for the pre-check.
 */
@Component
@ConditionalOnProperty(name = "alerting.suppression.mode", havingValue = "jpa", matchIfMissing = true)
public class JpaSuppressionStore implements SuppressionStore {

  private static final Logger log = LoggerFactory.getLogger(JpaSuppressionStore.class);

  private final SuppressionRecordRepository repository;
  private final TransactionTemplate transactionTemplate;
  private final TransactionTemplate newTransactionTemplate;
  private final Cache<SuppressionKey, SuppressionRecord> cache;

  public JpaSuppressionStore(SuppressionRecordRepository repository,
                             PlatformTransactionManager transactionManager,
                             @Value("${alerting.suppression.cache-size:10000}") int cacheSize) {
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.newTransactionTemplate = new TransactionTemplate(transactionManager);
    this.newTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.cache = Caffeine.newBuilder()
        .maximumSize(cacheSize)
        .build();
  }

  @Override
  public Map<UUID, SuppressionRecord> getOrCreate(Collection<UUID> ruleIds, long subjectId) {
    Map<UUID, SuppressionRecord> result = new HashMap<>();
    List<UUID> missing = new ArrayList<>();
    for (UUID ruleId : ruleIds) {
      SuppressionRecord cached = cache.getIfPresent(new SuppressionKey(ruleId, subjectId));
      if (cached != null) {
        result.put(ruleId, cached);
      } else {
        missing.add(ruleId);
      }
    }
    if (missing.isEmpty()) {
      return result;
    }

    loadInto(result, missing, subjectId);
    missing.removeAll(result.keySet());
    if (missing.isEmpty()) {
      return result;
    }

    createMissing(missing, subjectId);
    loadInto(result, missing, subjectId);
    return result;
  }

  @Override
  public boolean tryFire(UUID ruleId, long subjectId, Instant now, Duration cooldown) {
    Instant threshold = now.minus(cooldown);
    Integer updated = transactionTemplate.execute(
        status -> repository.markActiveIfCooledDown(ruleId, subjectId, now, threshold));

    if ((updated == null || updated == 0)
        && repository.findBySubjectIdAndRuleIdIn(subjectId, List.of(ruleId)).isEmpty()) {
      createMissing(List.of(ruleId), subjectId);
      updated = transactionTemplate.execute(
          status -> repository.markActiveIfCooledDown(ruleId, subjectId, now, threshold));
    }

    SuppressionKey key = new SuppressionKey(ruleId, subjectId);
    if (updated != null && updated > 0) {
      cache.put(key, new SuppressionRecord(ruleId, subjectId, now));
      return true;
    }
    cache.invalidate(key);
    return false;
  }

  private void createMissing(Collection<UUID> ruleIds, long subjectId) {
    try {
      newTransactionTemplate.executeWithoutResult(status -> {
        repository.saveAll(ruleIds.stream().map(ruleId -> new SuppressionRecordEntity(ruleId, subjectId)).toList());
        repository.flush();
      });
      return;
    } catch (DataIntegrityViolationException e) {
      log.debug("Bulk suppression insert conflicted, retrying per rule: subjectId={}, rules={}",
          subjectId, ruleIds.size());
    }
    for (UUID ruleId : ruleIds) {
      try {
        newTransactionTemplate.executeWithoutResult(
            status -> repository.saveAndFlush(new SuppressionRecordEntity(ruleId, subjectId)));
      } catch (DataIntegrityViolationException e) {
        log.debug("Suppression record created concurrently: ruleId={}, subjectId={}", ruleId, subjectId);
      }
    }
  }

  private void loadInto(Map<UUID, SuppressionRecord> result, Collection<UUID> ruleIds, long subjectId) {
    for (SuppressionRecordEntity entity : repository.findBySubjectIdAndRuleIdIn(subjectId, ruleIds)) {
      SuppressionRecord record = new SuppressionRecord(entity.getRuleId(), entity.getSubjectId(), entity.getLastActive());
      cache.put(new SuppressionKey(record.ruleId(), subjectId), record);
      result.put(record.ruleId(), record);
    }
  }
}
