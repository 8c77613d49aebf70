package com.harness.alerting.service;

import com.harness.alerting.enums.SubjectStatus;
import com.harness.alerting.model.Subject;
import com.harness.alerting.repository.SubjectEntity;
import com.harness.alerting.repository.SubjectRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SubjectService {

  private static final Logger log = LoggerFactory.getLogger(SubjectService.class);

  private final SubjectRepository repository;

  public SubjectService(SubjectRepository repository) {
    this.repository = repository;
  }

  public Subject getOrCreate(long projectId, long subjectId, Instant seenAt) {
    Optional<SubjectEntity> existing = repository.findById(subjectId);
    if (existing.isPresent()) {
      return touch(existing.get(), projectId, seenAt);
    }

    SubjectEntity entity = new SubjectEntity();
    entity.setId(subjectId);
    entity.setProjectId(projectId);
    entity.setStatus(SubjectStatus.UNRESOLVED);
    entity.setFirstSeen(seenAt);
    entity.setLastSeen(seenAt);
    try {
      return toModel(repository.saveAndFlush(entity));
    } catch (DataIntegrityViolationException e) {
      log.debug("Subject created concurrently: projectId={}, subjectId={}", projectId, subjectId);
      SubjectEntity raced = repository.findById(subjectId).orElseThrow(() -> e);
      return touch(raced, projectId, seenAt);
    }
  }

  @Transactional(readOnly = true)
  public Optional<Subject> find(long projectId, long subjectId) {
    return repository.findByIdAndProjectId(subjectId, projectId).map(this::toModel);
  }

  @Transactional(readOnly = true)
  public Map<Long, Subject> findAll(long projectId, Collection<Long> subjectIds) {
    Map<Long, Subject> result = new HashMap<>();
    for (SubjectEntity entity : repository.findByProjectIdAndIdIn(projectId, subjectIds)) {
      result.put(entity.getId(), toModel(entity));
    }
    return result;
  }

  @Transactional
  public Optional<Subject> updateStatus(long projectId, long subjectId, SubjectStatus status) {
    return repository.findByIdAndProjectId(subjectId, projectId).map(entity -> {
      entity.setStatus(status);
      return toModel(repository.save(entity));
    });
  }

  private Subject touch(SubjectEntity entity, long projectId, Instant seenAt) {
    if (entity.getProjectId() != projectId) {
      throw new IllegalArgumentException("Subject " + entity.getId() + " belongs to another project");
    }
    if (seenAt.isAfter(entity.getLastSeen())) {
      entity.setLastSeen(seenAt);
      entity = repository.save(entity);
    }
    return toModel(entity);
  }

  private Subject toModel(SubjectEntity entity) {
    return new Subject(entity.getId(), entity.getProjectId(), entity.getStatus());
  }
}
