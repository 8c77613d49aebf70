package com.harness.alerting.service;

import com.harness.alerting.enums.FirePath;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.model.RuleFireHistoryDto;
import com.harness.alerting.repository.RuleFireHistoryEntity;
import com.harness.alerting.repository.RuleFireHistoryRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RuleFireHistoryService {

  private final RuleFireHistoryRepository repository;

  public RuleFireHistoryService(RuleFireHistoryRepository repository) {
    this.repository = repository;
  }

  @Transactional
  public UUID record(RuleDto rule, AlertEvent event, FirePath path, Instant firedAt) {
    RuleFireHistoryEntity entity = new RuleFireHistoryEntity();
    entity.setRuleId(rule.id());
    entity.setProjectId(event.projectId());
    entity.setSubjectId(event.subjectId());
    entity.setEventId(event.eventId());
    entity.setNotificationUuid(UUID.randomUUID());
    entity.setPath(path);
    entity.setFiredAt(firedAt);
    return repository.save(entity).getNotificationUuid();
  }

  @Transactional(readOnly = true)
  public List<RuleFireHistoryDto> listForRule(UUID ruleId) {
    return repository.findByRuleIdOrderByFiredAtDesc(ruleId).stream()
        .map(e -> new RuleFireHistoryDto(
            e.getRuleId(), e.getSubjectId(), e.getEventId(), e.getNotificationUuid(), e.getPath(), e.getFiredAt()))
        .toList();
  }
}
