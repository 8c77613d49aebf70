package com.harness.alerting.buffer;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.redisson.api.RMap;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.LongCodec;
import org.redisson.client.codec.StringCodec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RedissonSharedBufferTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private RMap<String, String> hash;
  private RScoredSortedSet<Long> pending;
  private RedissonSharedBuffer buffer;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    RedissonClient redisson = mock(RedissonClient.class);
    hash = mock(RMap.class);
    pending = mock(RScoredSortedSet.class);
    given(redisson.<String, String>getMap(eq("alerting:delayed:hash:7"), eq(StringCodec.INSTANCE))).willReturn(hash);
    given(redisson.<Long>getScoredSortedSet(eq("alerting:delayed:pending"), eq(LongCodec.INSTANCE)))
        .willReturn(pending);
    buffer = new RedissonSharedBuffer(redisson, "alerting:delayed");
  }

  @Test
  void pushWritesProjectHashField() {
    buffer.push(7L, "field", "value");

    verify(hash).fastPut("field", "value");
  }

  @Test
  void deleteIsConditionalOnSnapshotValue() {
    buffer.delete(7L, Map.of("field", "value"));

    verify(hash).remove("field", "value");
  }

  @Test
  void pendingProjectsAreScoredByEpochMillis() {
    given(pending.valueRange(0, true, NOW.toEpochMilli(), true)).willReturn(List.of(7L, 8L));

    buffer.markPending(7L, NOW);

    verify(pending).add(NOW.toEpochMilli(), 7L);
    assertThat(buffer.pendingProjects(NOW)).containsExactlyInAnyOrder(7L, 8L);

    buffer.removePending(NOW);

    verify(pending).removeRangeByScore(0, true, NOW.toEpochMilli(), true);
  }
}
