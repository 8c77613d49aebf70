package com.harness.alerting.model;

import jakarta.validation.constraints.NotBlank;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ConditionSpec(
    @NotBlank String kind,
    Map<String, Object> params
) {

  public ConditionSpec {
    params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}
