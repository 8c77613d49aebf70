package com.harness.alerting.enums;

public enum FirePath {
  PER_EVENT,
  DELAYED
}
