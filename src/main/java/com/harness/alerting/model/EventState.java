package com.harness.alerting.model;

public record EventState(
    boolean isNew,
    boolean isRegression,
    boolean isNewGroupEnvironment,
    boolean hasReappeared,
    boolean hasEscalated
) {

  public static EventState none() {
    return new EventState(false, false, false, false, false);
  }
}
