package com.harness.alerting.buffer;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Field name of a buffered entry: {@code ownerId:subjectId:conditionGroupId[,conditionGroupId...]}.
 * Condition group ids are written in sorted order so the same logical key always encodes
 * identically.
 */
public record BufferKey(UUID ownerId, long subjectId, Set<UUID> conditionGroupIds) {

  public BufferKey {
    if (ownerId == null) {
      throw new IllegalArgumentException("ownerId is required");
    }
    if (conditionGroupIds == null || conditionGroupIds.isEmpty()) {
      throw new IllegalArgumentException("At least one condition group id is required");
    }
    conditionGroupIds = Set.copyOf(conditionGroupIds);
  }

  public String encode() {
    String groups = new TreeSet<>(conditionGroupIds).stream()
        .map(UUID::toString)
        .collect(Collectors.joining(","));
    return ownerId + ":" + subjectId + ":" + groups;
  }

  public static BufferKey decode(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("Buffer key is null");
    }
    String[] parts = raw.split(":", -1);
    if (parts.length != 3) {
      throw new IllegalArgumentException("Malformed buffer key: " + raw);
    }
    try {
      UUID ownerId = UUID.fromString(parts[0]);
      long subjectId = Long.parseLong(parts[1]);
      Set<UUID> groups = Arrays.stream(parts[2].split(",", -1))
          .map(UUID::fromString)
          .collect(Collectors.toSet());
      return new BufferKey(ownerId, subjectId, groups);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Malformed buffer key: " + raw, e);
    }
  }
}
