package com.harness.alerting.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.harness.alerting.enums.MatchMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record RuleDto(
    UUID id,
    Long projectId,
    String name,
    String environment,
    boolean enabled,
    boolean snoozed,
    // null when the stored combinator is unsupported; such rules never fire
    MatchMode actionMatch,
    MatchMode filterMatch,
    int frequencyMinutes,
    List<ConditionSpec> conditions,
    List<ActionSpec> actions,
    Instant createdAt,
    Instant updatedAt
) {

  @JsonIgnore
  public Duration frequency() {
    return Duration.ofMinutes(frequencyMinutes);
  }
}
