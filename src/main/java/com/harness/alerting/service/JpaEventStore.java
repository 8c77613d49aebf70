package com.harness.alerting.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.Subject;
import com.harness.alerting.repository.EventRecordEntity;
import com.harness.alerting.repository.EventRecordRepository;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaEventStore implements EventStore {

  private static final TypeReference<Map<String, String>> TAGS_TYPE = new TypeReference<>() {};

  private final EventRecordRepository repository;
  private final ObjectMapper objectMapper;

  public JpaEventStore(EventRecordRepository repository, ObjectMapper objectMapper) {
    this.repository = repository;
    this.objectMapper = objectMapper;
  }

  @Override
  @Transactional
  public void save(AlertEvent event) {
    EventRecordEntity entity = new EventRecordEntity();
    entity.setEventId(event.eventId());
    entity.setProjectId(event.projectId());
    entity.setSubjectId(event.subjectId());
    entity.setEnvironment(event.environment());
    entity.setLevel(event.level());
    entity.setMessage(event.message());
    entity.setPlatform(event.platform());
    entity.setUserId(event.userId());
    entity.setTagsJson(serializeTags(event.tags()));
    entity.setOccurrenceId(event.occurrenceId());
    entity.setTimestamp(event.timestamp());
    entity.setReceivedAt(event.receivedAt());
    repository.save(entity);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<AlertEvent> find(long projectId, String eventId, Subject subject) {
    return repository.findByEventIdAndProjectId(eventId, projectId)
        .filter(entity -> entity.getSubjectId() == subject.id())
        .map(entity -> new AlertEvent(
            entity.getEventId(),
            entity.getProjectId(),
            subject,
            entity.getEnvironment(),
            entity.getLevel(),
            entity.getMessage(),
            entity.getPlatform(),
            entity.getUserId(),
            deserializeTags(entity.getTagsJson()),
            entity.getOccurrenceId(),
            entity.getTimestamp(),
            entity.getReceivedAt()
        ));
  }

  private String serializeTags(Map<String, String> tags) {
    if (tags == null || tags.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(tags);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize event tags", e);
    }
  }

  private Map<String, String> deserializeTags(String json) {
    if (json == null) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, TAGS_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize event tags", e);
    }
  }
}
