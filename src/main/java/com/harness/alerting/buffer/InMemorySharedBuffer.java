package com.harness.alerting.buffer;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "alerting.buffer.mode", havingValue = "memory", matchIfMissing = true)
public class InMemorySharedBuffer implements SharedBuffer {

  private final Map<Long, Map<String, String>> hashes = new ConcurrentHashMap<>();
  private final Map<Long, Instant> pending = new ConcurrentHashMap<>();

  @Override
  public void push(long projectId, String field, String value) {
    hashes.compute(projectId, (id, hash) -> {
      Map<String, String> target = hash != null ? hash : new ConcurrentHashMap<>();
      target.put(field, value);
      return target;
    });
  }

  @Override
  public Map<String, String> readAll(long projectId) {
    Map<String, String> hash = hashes.get(projectId);
    return hash == null ? Map.of() : new HashMap<>(hash);
  }

  @Override
  public void delete(long projectId, Map<String, String> entries) {
    hashes.computeIfPresent(projectId, (id, hash) -> {
      entries.forEach(hash::remove);
      return hash.isEmpty() ? null : hash;
    });
  }

  int projectCount() {
    return hashes.size();
  }

  @Override
  public void markPending(long projectId, Instant at) {
    pending.put(projectId, at);
  }

  @Override
  public Set<Long> pendingProjects(Instant upTo) {
    Set<Long> due = new HashSet<>();
    pending.forEach((projectId, at) -> {
      if (!at.isAfter(upTo)) {
        due.add(projectId);
      }
    });
    return due;
  }

  @Override
  public void removePending(Instant upTo) {
    pending.forEach((projectId, at) -> {
      if (!at.isAfter(upTo)) {
        pending.remove(projectId, at);
      }
    });
  }
}
