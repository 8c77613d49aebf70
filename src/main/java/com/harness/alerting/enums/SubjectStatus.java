package com.harness.alerting.enums;

public enum SubjectStatus {
  UNRESOLVED,
  RESOLVED,
  IGNORED;

  public boolean isActionable() {
    return this == UNRESOLVED;
  }
}
