package com.harness.alerting.model;

import com.harness.alerting.enums.SubjectStatus;

public record Subject(
    long id,
    long projectId,
    SubjectStatus status
) {

  public boolean isActionable() {
    return status != null && status.isActionable();
  }
}
