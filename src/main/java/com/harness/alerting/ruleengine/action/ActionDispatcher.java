package com.harness.alerting.ruleengine.action;

import com.harness.alerting.common.Result;
import com.harness.alerting.model.AlertEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ActionDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

  public int dispatch(AlertEvent event, List<DispatchGroup> groups) {
    int succeeded = 0;
    for (DispatchGroup group : groups) {
      Result<Boolean> outcome = Result.run(() -> group.callback().invoke(event, group.futures()));
      if (outcome.isSuccess()) {
        succeeded++;
      } else {
        String key = group.futures().isEmpty() ? null : group.futures().get(0).key();
        log.error("Action dispatch failed: projectId={}, subjectId={}, eventId={}, key={}",
            event.projectId(), event.subjectId(), event.eventId(), key, outcome.error().orElse(null));
      }
    }
    return succeeded;
  }
}
