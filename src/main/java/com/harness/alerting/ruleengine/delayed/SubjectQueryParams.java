package com.harness.alerting.ruleengine.delayed;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

final class SubjectQueryParams {

  private final Set<Long> subjectIds = new HashSet<>();
  private Instant anchor;

  void add(long subjectId, Instant eventTime) {
    subjectIds.add(subjectId);
    if (eventTime != null && (anchor == null || eventTime.isAfter(anchor))) {
      anchor = eventTime;
    }
  }

  Set<Long> subjectIds() {
    return Set.copyOf(subjectIds);
  }

  Instant anchorOr(Instant fallback) {
    return anchor != null ? anchor : fallback;
  }
}
