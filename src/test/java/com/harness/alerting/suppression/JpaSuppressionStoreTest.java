package com.harness.alerting.suppression;

import com.harness.alerting.repository.SuppressionRecordEntity;
import com.harness.alerting.repository.SuppressionRecordRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaSuppressionStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaSuppressionStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
  private static final Duration HOUR = Duration.ofHours(1);
  private static final AtomicLong SUBJECTS = new AtomicLong(1000);
  private static final int THREADS = 8;

  @Autowired
  private JpaSuppressionStore store;

  @Autowired
  private SuppressionRecordRepository repository;

  @Test
  void getOrCreateCreatesOneRowPerRuleAndSubject() {
    long subjectId = SUBJECTS.incrementAndGet();
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();

    Map<UUID, SuppressionRecord> created = store.getOrCreate(List.of(first, second), subjectId);
    Map<UUID, SuppressionRecord> again = store.getOrCreate(List.of(first, second), subjectId);

    assertThat(created).containsOnlyKeys(first, second);
    assertThat(again).containsOnlyKeys(first, second);
    assertThat(repository.findBySubjectIdAndRuleIdIn(subjectId, List.of(first, second))).hasSize(2);
  }

  @Test
  void getOrCreateCreatesManyMissingRecordsAtOnce() {
    long subjectId = SUBJECTS.incrementAndGet();
    List<UUID> ruleIds = IntStream.range(0, 25).mapToObj(i -> UUID.randomUUID()).toList();

    Map<UUID, SuppressionRecord> created = store.getOrCreate(ruleIds, subjectId);

    assertThat(created).containsOnlyKeys(ruleIds);
    assertThat(created.values()).allSatisfy(record -> assertThat(record.lastActive()).isNull());
    assertThat(repository.findBySubjectIdAndRuleIdIn(subjectId, ruleIds)).hasSize(ruleIds.size());
  }

  @Test
  void getOrCreateMixesStoredAndMissingRecords() {
    long subjectId = SUBJECTS.incrementAndGet();
    UUID existing = UUID.randomUUID();
    repository.save(new SuppressionRecordEntity(existing, subjectId));
    List<UUID> ruleIds = List.of(existing, UUID.randomUUID(), UUID.randomUUID());

    Map<UUID, SuppressionRecord> created = store.getOrCreate(ruleIds, subjectId);

    assertThat(created).containsOnlyKeys(ruleIds);
    assertThat(repository.findBySubjectIdAndRuleIdIn(subjectId, ruleIds)).hasSize(3);
  }

  @Test
  void tryFireCreatesMissingRecord() {
    long subjectId = SUBJECTS.incrementAndGet();
    UUID ruleId = UUID.randomUUID();

    assertThat(store.tryFire(ruleId, subjectId, NOW, HOUR)).isTrue();

    assertThat(repository.findBySubjectIdAndRuleIdIn(subjectId, List.of(ruleId)))
        .singleElement()
        .satisfies(entity -> assertThat(entity.getLastActive()).isEqualTo(NOW));
  }

  @Test
  void tryFireRespectsCooldownWindow() {
    long subjectId = SUBJECTS.incrementAndGet();
    UUID ruleId = UUID.randomUUID();
    store.getOrCreate(List.of(ruleId), subjectId);

    assertThat(store.tryFire(ruleId, subjectId, NOW, HOUR)).isTrue();
    assertThat(store.tryFire(ruleId, subjectId, NOW.plus(Duration.ofMinutes(30)), HOUR)).isFalse();
    assertThat(store.tryFire(ruleId, subjectId, NOW.plus(HOUR), HOUR)).isTrue();
  }

  @Test
  void cachedRecordReflectsLatestFire() {
    long subjectId = SUBJECTS.incrementAndGet();
    UUID ruleId = UUID.randomUUID();
    store.getOrCreate(List.of(ruleId), subjectId);

    store.tryFire(ruleId, subjectId, NOW, HOUR);

    SuppressionRecord record = store.getOrCreate(List.of(ruleId), subjectId).get(ruleId);
    assertThat(record.isCoolingDown(NOW.plus(Duration.ofMinutes(5)), HOUR)).isTrue();
  }

  @Test
  void concurrentFiresOnExistingRecordHaveOneWinner() throws Exception {
    for (int round = 0; round < 5; round++) {
      long subjectId = SUBJECTS.incrementAndGet();
      UUID ruleId = UUID.randomUUID();
      store.getOrCreate(List.of(ruleId), subjectId);

      assertThat(raceTryFire(ruleId, subjectId)).isEqualTo(1);
    }
  }

  @Test
  void concurrentFiresOnMissingRecordHaveOneWinner() throws Exception {
    for (int round = 0; round < 5; round++) {
      long subjectId = SUBJECTS.incrementAndGet();
      UUID ruleId = UUID.randomUUID();

      assertThat(raceTryFire(ruleId, subjectId)).isEqualTo(1);
      assertThat(repository.findBySubjectIdAndRuleIdIn(subjectId, List.of(ruleId))).hasSize(1);
    }
  }

  private long raceTryFire(UUID ruleId, long subjectId) throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < THREADS; i++) {
        Callable<Boolean> attempt = () -> {
          start.await();
          return store.tryFire(ruleId, subjectId, NOW, HOUR);
        };
        results.add(executor.submit(attempt));
      }
      start.countDown();

      long winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      return winners;
    } finally {
      executor.shutdownNow();
    }
  }
}
