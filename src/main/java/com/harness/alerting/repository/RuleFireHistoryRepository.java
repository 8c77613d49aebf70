package com.harness.alerting.repository;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RuleFireHistoryRepository extends JpaRepository<RuleFireHistoryEntity, Long> {

  List<RuleFireHistoryEntity> findByRuleIdOrderByFiredAtDesc(UUID ruleId);

  long countByRuleIdAndSubjectId(UUID ruleId, Long subjectId);
}
