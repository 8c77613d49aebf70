package com.harness.alerting.ruleengine.processor;

import com.harness.alerting.common.Result;
import com.harness.alerting.enums.FirePath;
import com.harness.alerting.model.ActionSpec;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.ruleengine.action.ActionFuture;
import com.harness.alerting.ruleengine.action.ActionHandler;
import com.harness.alerting.ruleengine.action.ActionRegistry;
import com.harness.alerting.service.RuleFireHistoryService;
import com.harness.alerting.suppression.SuppressionStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RuleFirer {

  private static final Logger log = LoggerFactory.getLogger(RuleFirer.class);

  private final SuppressionStore suppressionStore;
  private final RuleFireHistoryService fireHistory;
  private final ActionRegistry actionRegistry;

  public RuleFirer(SuppressionStore suppressionStore,
                   RuleFireHistoryService fireHistory,
                   ActionRegistry actionRegistry) {
    this.suppressionStore = suppressionStore;
    this.fireHistory = fireHistory;
    this.actionRegistry = actionRegistry;
  }

  public List<ActionFuture> fire(RuleDto rule, AlertEvent event, Instant now, FirePath path) {
    if (!suppressionStore.tryFire(rule.id(), event.subjectId(), now, rule.frequency())) {
      log.debug("Fire lost to concurrent evaluation: ruleId={}, subjectId={}", rule.id(), event.subjectId());
      return List.of();
    }

    Result.of(() -> fireHistory.record(rule, event, path, now))
        .onFailure(e -> log.error("Failed to record fire history: ruleId={}, subjectId={}",
            rule.id(), event.subjectId(), e));

    List<ActionFuture> futures = new ArrayList<>();
    List<ActionSpec> actions = rule.actions() == null ? List.of() : rule.actions();
    for (ActionSpec action : actions) {
      Optional<ActionHandler> handler = actionRegistry.lookup(action.kind());
      if (handler.isEmpty()) {
        log.warn("Unregistered action kind: ruleId={}, kind={}", rule.id(), action.kind());
        continue;
      }
      futures.addAll(Result.of(() -> handler.get().after(event, rule, action))
          .onFailure(e -> log.error("Action hook failed: ruleId={}, kind={}", rule.id(), action.kind(), e))
          .getOrElse(List.of()));
    }
    log.info("Rule fired: ruleId={}, projectId={}, subjectId={}, path={}, futures={}",
        rule.id(), event.projectId(), event.subjectId(), path, futures.size());
    return futures;
  }
}
