package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.ConditionFamily;
import com.harness.alerting.model.ConditionSpec;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class ConditionRegistry {

  private static final List<String> SLOW_KIND_PREFIXES = List.of("event_frequency", "event_unique_user_frequency");

  private final Map<String, ConditionHandler> handlers;

  public ConditionRegistry(List<ConditionHandler> handlers) {
    Map<String, ConditionHandler> byKind = new HashMap<>();
    for (ConditionHandler handler : handlers) {
      if (byKind.putIfAbsent(handler.kind(), handler) != null) {
        throw new IllegalStateException("Duplicate condition kind: " + handler.kind());
      }
    }
    this.handlers = Map.copyOf(byKind);
  }

  public Optional<ConditionHandler> lookup(String kind) {
    return Optional.ofNullable(handlers.get(kind));
  }

  public Set<String> kinds() {
    return handlers.keySet();
  }

  // Unknown kinds count as conditions and fail action matching.
  public ConditionFamily familyOf(ConditionSpec spec) {
    return lookup(spec.kind()).map(ConditionHandler::family).orElse(ConditionFamily.CONDITION);
  }

  // Frequency kinds stay slow without a handler so the per-event path never fires them.
  public boolean isSlow(ConditionSpec spec) {
    Optional<ConditionHandler> handler = lookup(spec.kind());
    if (handler.isPresent()) {
      return !handler.get().isFast();
    }
    return SLOW_KIND_PREFIXES.stream().anyMatch(prefix -> spec.kind().startsWith(prefix));
  }
}
