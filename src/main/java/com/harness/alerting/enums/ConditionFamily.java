package com.harness.alerting.enums;

public enum ConditionFamily {
  CONDITION,
  FILTER
}
