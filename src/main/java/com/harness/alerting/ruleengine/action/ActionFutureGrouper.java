package com.harness.alerting.ruleengine.action;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ActionFutureGrouper {

  private ActionFutureGrouper() {
  }

  public static List<DispatchGroup> group(List<ActionFuture> futures) {
    Map<Object, List<ActionFuture>> byKey = new LinkedHashMap<>();
    for (ActionFuture future : futures) {
      Object key = future.key() != null ? future.key() : future.callback();
      byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(future);
    }

    List<DispatchGroup> groups = new ArrayList<>(byKey.size());
    for (List<ActionFuture> grouped : byKey.values()) {
      groups.add(new DispatchGroup(grouped.get(0).callback(), grouped));
    }
    return groups;
  }
}
