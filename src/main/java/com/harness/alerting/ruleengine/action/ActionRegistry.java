package com.harness.alerting.ruleengine.action;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class ActionRegistry {

  private final Map<String, ActionHandler> handlers;

  public ActionRegistry(List<ActionHandler> handlers) {
    Map<String, ActionHandler> byKind = new HashMap<>();
    for (ActionHandler handler : handlers) {
      if (byKind.putIfAbsent(handler.kind(), handler) != null) {
        throw new IllegalStateException("Duplicate action kind: " + handler.kind());
      }
    }
    this.handlers = Map.copyOf(byKind);
  }

  public Optional<ActionHandler> lookup(String kind) {
    return Optional.ofNullable(handlers.get(kind));
  }
}
