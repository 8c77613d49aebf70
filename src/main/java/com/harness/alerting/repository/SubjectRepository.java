package com.harness.alerting.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubjectRepository extends JpaRepository<SubjectEntity, Long> {

  Optional<SubjectEntity> findByIdAndProjectId(Long id, Long projectId);

  List<SubjectEntity> findByProjectIdAndIdIn(Long projectId, Collection<Long> ids);
}
