package com.harness.alerting.buffer;

import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.redisson.api.RMap;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.LongCodec;
import org.redisson.client.codec.StringCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "alerting.buffer.mode", havingValue = "redis")
public class RedissonSharedBuffer implements SharedBuffer {

  private final RedissonClient redisson;
  private final String keyPrefix;

  public RedissonSharedBuffer(RedissonClient redisson,
                              @Value("${alerting.buffer.key-prefix:alerting:delayed}") String keyPrefix) {
    this.redisson = redisson;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public void push(long projectId, String field, String value) {
    hash(projectId).fastPut(field, value);
  }

  @Override
  public Map<String, String> readAll(long projectId) {
    return hash(projectId).readAllMap();
  }

  @Override
  public void delete(long projectId, Map<String, String> entries) {
    RMap<String, String> hash = hash(projectId);
    entries.forEach(hash::remove);
  }

  @Override
  public void markPending(long projectId, Instant at) {
    pending().add(at.toEpochMilli(), projectId);
  }

  @Override
  public Set<Long> pendingProjects(Instant upTo) {
    return new HashSet<>(pending().valueRange(0, true, upTo.toEpochMilli(), true));
  }

  @Override
  public void removePending(Instant upTo) {
    pending().removeRangeByScore(0, true, upTo.toEpochMilli(), true);
  }

  private RMap<String, String> hash(long projectId) {
    return redisson.getMap(keyPrefix + ":hash:" + projectId, StringCodec.INSTANCE);
  }

  private RScoredSortedSet<Long> pending() {
    return redisson.getScoredSortedSet(keyPrefix + ":pending", LongCodec.INSTANCE);
  }
}
