package com.harness.alerting.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alerting.enums.MatchMode;
import com.harness.alerting.model.ActionSpec;
import com.harness.alerting.model.ConditionSpec;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.repository.RuleEntity;
import com.harness.alerting.repository.RuleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RuleService {

  private final RuleRepository repository;
  private final RuleValidator validator;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public RuleService(RuleRepository repository, RuleValidator validator, ObjectMapper objectMapper, Clock clock) {
    this.repository = repository;
    this.validator = validator;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Transactional
  public RuleDto createRule(long projectId, RuleDto request) {
    validator.validate(request);
    Instant now = Instant.now(clock);
    RuleEntity entity = new RuleEntity();
    entity.setId(UUID.randomUUID());
    entity.setProjectId(projectId);
    entity.setSnoozed(false);
    entity.setCreatedAt(now);
    apply(entity, request, now);
    return toDto(repository.save(entity));
  }

  @Transactional(readOnly = true)
  public List<RuleDto> listRules(long projectId, Boolean enabled) {
    List<RuleEntity> entities = enabled != null
        ? repository.findByProjectIdAndEnabled(projectId, enabled)
        : repository.findByProjectId(projectId);
    return entities.stream().map(this::toDto).toList();
  }

  @Transactional(readOnly = true)
  public List<RuleDto> listActiveRules(long projectId) {
    return repository.findByProjectIdAndEnabledTrueAndSnoozedFalse(projectId).stream()
        .map(this::toDto)
        .toList();
  }

  @Transactional(readOnly = true)
  public Map<UUID, RuleDto> findActiveRules(long projectId, Collection<UUID> ruleIds) {
    Map<UUID, RuleDto> result = new LinkedHashMap<>();
    for (RuleEntity entity : repository.findAllById(ruleIds)) {
      if (entity.getProjectId() == projectId && entity.isEnabled() && !entity.isSnoozed()) {
        result.put(entity.getId(), toDto(entity));
      }
    }
    return result;
  }

  @Transactional(readOnly = true)
  public Optional<RuleDto> getRule(long projectId, UUID ruleId) {
    return repository.findByIdAndProjectId(ruleId, projectId).map(this::toDto);
  }

  @Transactional
  public Optional<RuleDto> updateRule(long projectId, UUID ruleId, RuleDto request) {
    validator.validate(request);
    return repository.findByIdAndProjectId(ruleId, projectId).map(existing -> {
      apply(existing, request, Instant.now(clock));
      return toDto(repository.save(existing));
    });
  }

  @Transactional
  public boolean deleteRule(long projectId, UUID ruleId) {
    return repository.findByIdAndProjectId(ruleId, projectId)
        .map(entity -> {
          repository.delete(entity);
          return true;
        })
        .orElse(false);
  }

  @Transactional
  public Optional<RuleDto> setRuleEnabled(long projectId, UUID ruleId, boolean enabled) {
    return repository.findByIdAndProjectId(ruleId, projectId).map(entity -> {
      entity.setEnabled(enabled);
      entity.setUpdatedAt(Instant.now(clock));
      return toDto(repository.save(entity));
    });
  }

  @Transactional
  public Optional<RuleDto> setRuleSnoozed(long projectId, UUID ruleId, boolean snoozed) {
    return repository.findByIdAndProjectId(ruleId, projectId).map(entity -> {
      entity.setSnoozed(snoozed);
      entity.setUpdatedAt(Instant.now(clock));
      return toDto(repository.save(entity));
    });
  }

  private void apply(RuleEntity entity, RuleDto request, Instant now) {
    entity.setName(request.name());
    entity.setEnvironment(request.environment());
    entity.setEnabled(request.enabled());
    entity.setActionMatch(request.actionMatch().name());
    entity.setFilterMatch(request.filterMatch() != null ? request.filterMatch().name() : MatchMode.ALL.name());
    entity.setFrequencyMinutes(request.frequencyMinutes());
    entity.setConditionsJson(serialize(request.conditions() != null ? request.conditions() : List.of(), "conditions"));
    entity.setActionsJson(serialize(request.actions() != null ? request.actions() : List.of(), "actions"));
    entity.setUpdatedAt(now);
  }

  private String serialize(Object value, String what) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize " + what, e);
    }
  }

  private <T> List<T> deserializeList(String json, Class<T> elementType) {
    try {
      return objectMapper.readValue(
          json,
          objectMapper.getTypeFactory().constructCollectionType(List.class, elementType)
      );
    } catch (Exception e) {
      throw new IllegalStateException("Failed to deserialize " + elementType.getSimpleName() + " list", e);
    }
  }

  private RuleDto toDto(RuleEntity entity) {
    return new RuleDto(
        entity.getId(),
        entity.getProjectId(),
        entity.getName(),
        entity.getEnvironment(),
        entity.isEnabled(),
        entity.isSnoozed(),
        MatchMode.fromValue(entity.getActionMatch()).orElse(null),
        MatchMode.fromValue(entity.getFilterMatch()).orElse(null),
        entity.getFrequencyMinutes(),
        deserializeList(entity.getConditionsJson(), ConditionSpec.class),
        deserializeList(entity.getActionsJson(), ActionSpec.class),
        entity.getCreatedAt(),
        entity.getUpdatedAt()
    );
  }
}
