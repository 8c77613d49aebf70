package com.harness.alerting.ratequery;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class RateQueryHandlerRegistry {

  private final Map<String, RateQueryHandler> handlers;

  public RateQueryHandlerRegistry(List<RateQueryHandler> handlers) {
    Map<String, RateQueryHandler> byKind = new HashMap<>();
    for (RateQueryHandler handler : handlers) {
      if (byKind.putIfAbsent(handler.kind(), handler) != null) {
        throw new IllegalStateException("Duplicate rate query handler: " + handler.kind());
      }
    }
    this.handlers = Map.copyOf(byKind);
  }

  public Optional<RateQueryHandler> lookup(String kind) {
    return Optional.ofNullable(handlers.get(kind));
  }
}
