package com.harness.alerting.ruleengine.processor;

import com.harness.alerting.buffer.DelayedRuleBuffer;
import com.harness.alerting.common.Result;
import com.harness.alerting.enums.ConditionFamily;
import com.harness.alerting.enums.FirePath;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.ConditionSpec;
import com.harness.alerting.model.EventState;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.ruleengine.action.ActionFuture;
import com.harness.alerting.ruleengine.action.ActionFutureGrouper;
import com.harness.alerting.ruleengine.action.DispatchGroup;
import com.harness.alerting.ruleengine.registry.ConditionHandler;
import com.harness.alerting.ruleengine.registry.ConditionRegistry;
import com.harness.alerting.ruleengine.registry.EventConditionHandler;
import com.harness.alerting.service.RuleService;
import com.harness.alerting.suppression.SuppressionRecord;
import com.harness.alerting.suppression.SuppressionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-event rule evaluation. For every active rule of the event's project the rule is rejected,
 * deferred to the delayed buffer (when slow conditions decide the outcome) or fired.
 *
 * <p>Failures are contained per rule: a throwing handler counts as a non-match for its own rule
 * only, and {@link #evaluate} never throws.
 */
@Component
public class RuleProcessor {

  private static final Logger log = LoggerFactory.getLogger(RuleProcessor.class);

  private final RuleService ruleService;
  private final ConditionRegistry conditionRegistry;
  private final SuppressionStore suppressionStore;
  private final DelayedRuleBuffer delayedBuffer;
  private final RuleFirer ruleFirer;
  private final Clock clock;

  public RuleProcessor(RuleService ruleService,
                       ConditionRegistry conditionRegistry,
                       SuppressionStore suppressionStore,
                       DelayedRuleBuffer delayedBuffer,
                       RuleFirer ruleFirer,
                       Clock clock) {
    this.ruleService = ruleService;
    this.conditionRegistry = conditionRegistry;
    this.suppressionStore = suppressionStore;
    this.delayedBuffer = delayedBuffer;
    this.ruleFirer = ruleFirer;
    this.clock = clock;
  }

  /**
   * @return dispatch groups to run, one per distinct action future key
   */
  public List<DispatchGroup> evaluate(AlertEvent event, EventState state) {
    if (!event.subject().isActionable()) {
      log.debug("Subject not actionable: projectId={}, subjectId={}, status={}",
          event.projectId(), event.subjectId(), event.subject().status());
      return List.of();
    }

    List<RuleDto> rules = Result.of(() -> ruleService.listActiveRules(event.projectId()))
        .onFailure(e -> log.error("Failed to load rules: projectId={}", event.projectId(), e))
        .getOrElse(List.of());
    if (rules.isEmpty()) {
      return List.of();
    }

    List<UUID> ruleIds = rules.stream().map(RuleDto::id).toList();
    Map<UUID, SuppressionRecord> records =
        Result.of(() -> suppressionStore.getOrCreate(ruleIds, event.subjectId()))
            .onFailure(e -> log.warn("Suppression records unavailable, relying on fire-time check: subjectId={}",
                event.subjectId(), e))
            .getOrElse(Map.of());

    Instant now = Instant.now(clock);
    List<ActionFuture> futures = new ArrayList<>();
    for (RuleDto rule : rules) {
      futures.addAll(Result.of(() -> applyRule(rule, event, state, records.get(rule.id()), now))
          .onFailure(e -> log.error("Rule evaluation failed: ruleId={}, subjectId={}", rule.id(), event.subjectId(), e))
          .getOrElse(List.of()));
    }
    return ActionFutureGrouper.group(futures);
  }

  private List<ActionFuture> applyRule(RuleDto rule,
                                       AlertEvent event,
                                       EventState state,
                                       SuppressionRecord record,
                                       Instant now) {
    if (rule.environment() != null && !rule.environment().equals(event.environment())) {
      return List.of();
    }
    if (record != null && record.isCoolingDown(now, rule.frequency())) {
      log.debug("Rule in cooldown: ruleId={}, subjectId={}", rule.id(), event.subjectId());
      return List.of();
    }
    if (rule.actionMatch() == null || rule.filterMatch() == null) {
      log.error("Unsupported match mode, rule skipped: ruleId={}", rule.id());
      return List.of();
    }

    List<ConditionSpec> filters = new ArrayList<>();
    List<ConditionSpec> fast = new ArrayList<>();
    List<ConditionSpec> slow = new ArrayList<>();
    for (ConditionSpec condition : rule.conditions() == null ? List.<ConditionSpec>of() : rule.conditions()) {
      if (conditionRegistry.familyOf(condition) == ConditionFamily.FILTER) {
        filters.add(condition);
      } else if (conditionRegistry.isSlow(condition)) {
        slow.add(condition);
      } else {
        fast.add(condition);
      }
    }

    if (!MatchEvaluator.apply(rule.filterMatch(), evaluateAll(rule, filters, event, state))) {
      return List.of();
    }
    boolean fastPassed = MatchEvaluator.apply(rule.actionMatch(), evaluateAll(rule, fast, event, state));

    RuleDecision decision = RuleDecision.of(rule.actionMatch(), fastPassed, !slow.isEmpty());
    log.debug("Rule decision: ruleId={}, subjectId={}, decision={}", rule.id(), event.subjectId(), decision);
    return switch (decision) {
      case REJECT -> List.of();
      case DEFER -> {
        delayedBuffer.enqueue(event, rule);
        yield List.of();
      }
      case FIRE -> ruleFirer.fire(rule, event, now, FirePath.PER_EVENT);
    };
  }

  private List<Boolean> evaluateAll(RuleDto rule, List<ConditionSpec> conditions, AlertEvent event, EventState state) {
    List<Boolean> results = new ArrayList<>(conditions.size());
    for (ConditionSpec condition : conditions) {
      results.add(evaluateOne(rule, condition, event, state));
    }
    return results;
  }

  private boolean evaluateOne(RuleDto rule, ConditionSpec condition, AlertEvent event, EventState state) {
    Optional<ConditionHandler> handler = conditionRegistry.lookup(condition.kind());
    if (handler.isEmpty()) {
      log.warn("Unregistered condition kind treated as no match: ruleId={}, kind={}", rule.id(), condition.kind());
      return false;
    }
    if (!(handler.get() instanceof EventConditionHandler eventHandler)) {
      return false;
    }
    return Result.of(() -> eventHandler.passes(event, condition.params(), state))
        .onFailure(e -> log.error("Condition failed, treated as no match: ruleId={}, kind={}",
            rule.id(), condition.kind(), e))
        .getOrElse(false);
  }
}
