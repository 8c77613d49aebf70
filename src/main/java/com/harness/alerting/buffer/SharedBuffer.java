package com.harness.alerting.buffer;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Key/value store shared between the per-event evaluators that write deferred work and the
 * delayed processor that consumes it.
 */
public interface SharedBuffer {

  /**
   * Insert or overwrite one field of the project's hash.
   */
  void push(long projectId, String field, String value);

  Map<String, String> readAll(long projectId);

  /**
   * Remove each field only if it still holds the given value, so entries rewritten after the
   * snapshot was read survive.
   */
  void delete(long projectId, Map<String, String> entries);

  void markPending(long projectId, Instant at);

  Set<Long> pendingProjects(Instant upTo);

  void removePending(Instant upTo);
}
