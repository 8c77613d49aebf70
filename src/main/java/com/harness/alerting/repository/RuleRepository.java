package com.harness.alerting.repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RuleRepository extends JpaRepository<RuleEntity, UUID> {

  List<RuleEntity> findByProjectId(Long projectId);

  List<RuleEntity> findByProjectIdAndEnabled(Long projectId, boolean enabled);

  List<RuleEntity> findByProjectIdAndEnabledTrueAndSnoozedFalse(Long projectId);

  Optional<RuleEntity> findByIdAndProjectId(UUID id, Long projectId);
}
