package com.harness.alerting.ruleengine.delayed;

import com.harness.alerting.buffer.BufferEntry;
import com.harness.alerting.buffer.BufferPayload;
import com.harness.alerting.buffer.DelayedRuleBuffer;
import com.harness.alerting.buffer.DrainedBatch;
import com.harness.alerting.common.Result;
import com.harness.alerting.enums.ConditionFamily;
import com.harness.alerting.enums.FirePath;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.ConditionSpec;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.model.Subject;
import com.harness.alerting.ratequery.RateQueryHandler;
import com.harness.alerting.ratequery.RateQueryHandlerRegistry;
import com.harness.alerting.ratequery.RateWindows;
import com.harness.alerting.ratequery.UniqueConditionQuery;
import com.harness.alerting.ruleengine.action.ActionDispatcher;
import com.harness.alerting.ruleengine.action.ActionFuture;
import com.harness.alerting.ruleengine.action.ActionFutureGrouper;
import com.harness.alerting.ruleengine.action.DispatchGroup;
import com.harness.alerting.ruleengine.processor.MatchEvaluator;
import com.harness.alerting.ruleengine.processor.RuleFirer;
import com.harness.alerting.ruleengine.registry.ConditionRegistry;
import com.harness.alerting.ruleengine.registry.FrequencyConditionHandler;
import com.harness.alerting.service.EventStore;
import com.harness.alerting.service.RuleService;
import com.harness.alerting.service.SubjectService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the rules the per-event pass deferred because of slow conditions.
 *
 * <p>One call handles every buffered entry of a project: entries are grouped by condition
 * group, the slow conditions of all groups are reduced to distinct aggregate queries, each
 * query runs once, and every (group, subject) pair is decided from those results alone.
 * Subjects with at least one firing group get a single dispatch covering the actions of all
 * their firing groups. A failing query only fails the conditions that needed it.
 */
@Component
public class DelayedRuleProcessor {

  private static final Logger log = LoggerFactory.getLogger(DelayedRuleProcessor.class);

  private final DelayedRuleBuffer buffer;
  private final RuleService ruleService;
  private final SubjectService subjectService;
  private final EventStore eventStore;
  private final ConditionRegistry conditionRegistry;
  private final UniqueQueryPlanner queryPlanner;
  private final RateQueryHandlerRegistry rateHandlers;
  private final RuleFirer ruleFirer;
  private final ActionDispatcher dispatcher;
  private final Clock clock;

  public DelayedRuleProcessor(DelayedRuleBuffer buffer,
                              RuleService ruleService,
                              SubjectService subjectService,
                              EventStore eventStore,
                              ConditionRegistry conditionRegistry,
                              UniqueQueryPlanner queryPlanner,
                              RateQueryHandlerRegistry rateHandlers,
                              RuleFirer ruleFirer,
                              ActionDispatcher dispatcher,
                              Clock clock) {
    this.buffer = buffer;
    this.ruleService = ruleService;
    this.subjectService = subjectService;
    this.eventStore = eventStore;
    this.conditionRegistry = conditionRegistry;
    this.queryPlanner = queryPlanner;
    this.rateHandlers = rateHandlers;
    this.ruleFirer = ruleFirer;
    this.dispatcher = dispatcher;
    this.clock = clock;
  }

  /**
   * Never throws. When a run fails before the drained entries are deleted, the project is
   * marked pending again so the entries are retried.
   */
  public void processProject(long projectId) {
    try {
      doProcessProject(projectId);
    } catch (Exception e) {
      log.error("Delayed processing failed: projectId={}", projectId, e);
      Result.run(() -> buffer.markPending(projectId))
          .onFailure(ex -> log.error("Failed to re-mark project pending: projectId={}", projectId, ex));
    }
  }

  private void doProcessProject(long projectId) {
    DrainedBatch batch = buffer.drainProject(projectId);
    if (batch.isEmpty()) {
      log.debug("No buffered entries: projectId={}", projectId);
      return;
    }
    Instant now = Instant.now(clock);

    List<ConditionGroupWork> groups = loadConditionGroups(projectId, batch.entries());
    Map<UniqueConditionQuery, SubjectQueryParams> plan = queryPlanner.plan(groups);
    Map<UniqueConditionQuery, Map<Long, Double>> rates = runQueries(plan, now);

    Map<Long, List<ConditionGroupWork>> firingBySubject = new LinkedHashMap<>();
    for (ConditionGroupWork group : groups) {
      for (Long subjectId : group.subjects().keySet()) {
        if (groupPasses(group, subjectId, rates)) {
          firingBySubject.computeIfAbsent(subjectId, id -> new ArrayList<>()).add(group);
        }
      }
    }

    int dispatched = fireSubjects(projectId, firingBySubject, now);

    buffer.delete(projectId, batch);
    log.info("Delayed processing done: projectId={}, entries={}, groups={}, queries={}, firingSubjects={}, dispatched={}",
        projectId, batch.raw().size(), groups.size(), plan.size(), firingBySubject.size(), dispatched);
  }

  private List<ConditionGroupWork> loadConditionGroups(long projectId, List<BufferEntry> entries) {
    Map<UUID, Map<Long, BufferPayload>> subjectsByGroup = new LinkedHashMap<>();
    Map<UUID, UUID> ownerByGroup = new HashMap<>();
    for (BufferEntry entry : entries) {
      for (UUID groupId : entry.key().conditionGroupIds()) {
        ownerByGroup.put(groupId, entry.key().ownerId());
        subjectsByGroup.computeIfAbsent(groupId, id -> new HashMap<>())
            .merge(entry.key().subjectId(), entry.payload(), DelayedRuleProcessor::latest);
      }
    }

    Map<UUID, RuleDto> rules = ruleService.findActiveRules(projectId, Set.copyOf(ownerByGroup.values()));

    List<ConditionGroupWork> groups = new ArrayList<>();
    for (Map.Entry<UUID, Map<Long, BufferPayload>> e : subjectsByGroup.entrySet()) {
      UUID groupId = e.getKey();
      RuleDto rule = rules.get(ownerByGroup.get(groupId));
      if (rule == null || !rule.id().equals(groupId)) {
        log.debug("Skipping stale condition group: projectId={}, groupId={}", projectId, groupId);
        continue;
      }
      if (rule.actionMatch() == null) {
        log.error("Unsupported match mode, rule skipped: ruleId={}", rule.id());
        continue;
      }
      List<ConditionSpec> slow = (rule.conditions() == null ? List.<ConditionSpec>of() : rule.conditions()).stream()
          .filter(c -> conditionRegistry.familyOf(c) == ConditionFamily.CONDITION)
          .filter(conditionRegistry::isSlow)
          .toList();
      if (slow.isEmpty()) {
        log.debug("Condition group has no slow conditions left: ruleId={}", rule.id());
        continue;
      }
      groups.add(new ConditionGroupWork(rule, slow, e.getValue()));
    }
    return groups;
  }

  private Map<UniqueConditionQuery, Map<Long, Double>> runQueries(Map<UniqueConditionQuery, SubjectQueryParams> plan,
                                                                  Instant now) {
    Map<UniqueConditionQuery, Map<Long, Double>> rates = new HashMap<>();
    for (Map.Entry<UniqueConditionQuery, SubjectQueryParams> e : plan.entrySet()) {
      UniqueConditionQuery query = e.getKey();
      SubjectQueryParams params = e.getValue();
      Map<Long, Double> result = Result.of(() -> runQuery(query, params, now))
          .onFailure(ex -> log.warn("Rate query failed, treating as empty: query={}, subjects={}",
              query, params.subjectIds().size(), ex))
          .getOrElse(Map.of());
      rates.put(query, result);
    }
    return rates;
  }

  private Map<Long, Double> runQuery(UniqueConditionQuery query, SubjectQueryParams params, Instant now)
      throws Exception {
    RateQueryHandler handler = rateHandlers.lookup(query.handlerKind())
        .orElseThrow(() -> new IllegalStateException("No rate query handler for " + query.handlerKind()));
    Duration duration = RateWindows.interval(query.interval());
    Duration comparison = query.comparisonInterval() != null
        ? RateWindows.comparisonInterval(query.comparisonInterval())
        : null;
    return handler.getRatesBulk(duration, params.subjectIds(), query.environment(), params.anchorOr(now), comparison);
  }

  private boolean groupPasses(ConditionGroupWork group,
                              long subjectId,
                              Map<UniqueConditionQuery, Map<Long, Double>> rates) {
    List<Boolean> results = new ArrayList<>(group.slowConditions().size());
    for (ConditionSpec condition : group.slowConditions()) {
      results.add(conditionPasses(group.rule(), condition, subjectId, rates));
    }
    return MatchEvaluator.apply(group.rule().actionMatch(), results);
  }

  private boolean conditionPasses(RuleDto rule,
                                  ConditionSpec condition,
                                  long subjectId,
                                  Map<UniqueConditionQuery, Map<Long, Double>> rates) {
    Optional<FrequencyConditionHandler> handler = queryPlanner.frequencyHandler(condition);
    if (handler.isEmpty()) {
      log.warn("Unregistered slow condition treated as no match: ruleId={}, kind={}", rule.id(), condition.kind());
      return false;
    }
    List<UniqueConditionQuery> queries = queryPlanner.queriesFor(condition, rule.environment());
    if (queries.isEmpty()) {
      return false;
    }
    List<Double> values = new ArrayList<>(queries.size());
    for (UniqueConditionQuery query : queries) {
      Double value = rates.getOrDefault(query, Map.of()).get(subjectId);
      if (value == null) {
        return false;
      }
      values.add(value);
    }
    return Result.of(() -> handler.get().passes(condition.params(), values))
        .onFailure(e -> log.error("Slow condition failed, treated as no match: ruleId={}, kind={}",
            rule.id(), condition.kind(), e))
        .getOrElse(false);
  }

  private int fireSubjects(long projectId, Map<Long, List<ConditionGroupWork>> firingBySubject, Instant now) {
    if (firingBySubject.isEmpty()) {
      return 0;
    }
    Map<Long, Subject> subjects = subjectService.findAll(projectId, firingBySubject.keySet());

    int dispatched = 0;
    for (Map.Entry<Long, List<ConditionGroupWork>> e : firingBySubject.entrySet()) {
      Long subjectId = e.getKey();
      Subject subject = subjects.get(subjectId);
      if (subject == null) {
        log.debug("Skipping stale subject: projectId={}, subjectId={}", projectId, subjectId);
        continue;
      }
      if (!subject.isActionable()) {
        log.debug("Subject not actionable: projectId={}, subjectId={}, status={}", projectId, subjectId, subject.status());
        continue;
      }

      BufferPayload payload = e.getValue().stream()
          .map(group -> group.subjects().get(subjectId))
          .reduce(DelayedRuleProcessor::latest)
          .orElseThrow();
      Optional<AlertEvent> event = eventStore.find(projectId, payload.eventId(), subject);
      if (event.isEmpty()) {
        log.debug("Skipping subject with unknown buffered event: subjectId={}, eventId={}", subjectId, payload.eventId());
        continue;
      }

      List<ActionFuture> futures = new ArrayList<>();
      for (ConditionGroupWork group : e.getValue()) {
        futures.addAll(Result.of(() -> ruleFirer.fire(group.rule(), event.get(), now, FirePath.DELAYED))
            .onFailure(ex -> log.error("Delayed fire failed: ruleId={}, subjectId={}", group.rule().id(), subjectId, ex))
            .getOrElse(List.of()));
      }
      List<DispatchGroup> dispatchGroups = ActionFutureGrouper.group(futures);
      if (!dispatchGroups.isEmpty()) {
        dispatcher.dispatch(event.get(), dispatchGroups);
        dispatched += dispatchGroups.size();
      }
    }
    return dispatched;
  }

  private static BufferPayload latest(BufferPayload a, BufferPayload b) {
    if (a.timestamp() == null) {
      return b;
    }
    if (b.timestamp() == null) {
      return a;
    }
    return b.timestamp().isAfter(a.timestamp()) ? b : a;
  }
}
