package com.harness.alerting.ruleengine.registry;

import java.util.Map;

final class ConditionParams {

  private ConditionParams() {
  }

  static String string(Map<String, Object> params, String name) {
    Object value = params == null ? null : params.get(name);
    return value == null ? null : value.toString();
  }

  static String requiredString(Map<String, Object> params, String name) {
    String value = string(params, name);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing condition parameter: " + name);
    }
    return value;
  }

  static double number(Map<String, Object> params, String name) {
    Object value = params == null ? null : params.get(name);
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value == null) {
      throw new IllegalArgumentException("Missing condition parameter: " + name);
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Condition parameter " + name + " is not a number: " + value, e);
    }
  }
}
