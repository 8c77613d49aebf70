package com.harness.alerting.ruleengine.action;

import java.util.List;

public record DispatchGroup(ActionCallback callback, List<ActionFuture> futures) {

  public DispatchGroup {
    futures = List.copyOf(futures);
  }
}
