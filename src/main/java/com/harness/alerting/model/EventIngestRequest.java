package com.harness.alerting.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;
import java.util.Map;

public record EventIngestRequest(
    String eventId,
    @NotNull @Positive Long subjectId,
    String environment,
    String level,
    String message,
    String platform,
    String userId,
    Map<String, String> tags,
    String occurrenceId,
    Instant timestamp,
    @JsonProperty("isNew") boolean isNew,
    @JsonProperty("isRegression") boolean isRegression,
    @JsonProperty("isNewGroupEnvironment") boolean isNewGroupEnvironment,
    @JsonProperty("hasReappeared") boolean hasReappeared,
    @JsonProperty("hasEscalated") boolean hasEscalated
) {

  public EventState toState() {
    return new EventState(isNew, isRegression, isNewGroupEnvironment, hasReappeared, hasEscalated);
  }
}
