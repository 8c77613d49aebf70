package com.harness.alerting.repository;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EventRecordRepository extends JpaRepository<EventRecordEntity, String> {

  Optional<EventRecordEntity> findByEventIdAndProjectId(String eventId, Long projectId);
}
