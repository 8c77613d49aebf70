package com.harness.alerting.model;

import jakarta.validation.constraints.NotBlank;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ActionSpec(
    @NotBlank String kind,
    Map<String, Object> params
) {

  public ActionSpec {
    params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}
