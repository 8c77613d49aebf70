package com.harness.alerting.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "events", indexes = @Index(name = "idx_events_subject", columnList = "project_id, subject_id"))
public class EventRecordEntity {

  @Id
  @Column(name = "event_id", nullable = false, updatable = false, length = 64)
  private String eventId;

  @Column(name = "project_id", nullable = false)
  private Long projectId;

  @Column(name = "subject_id", nullable = false)
  private Long subjectId;

  @Column(name = "environment")
  private String environment;

  @Column(name = "level", length = 16)
  private String level;

  @Column(name = "message", length = 4000)
  private String message;

  @Column(name = "platform")
  private String platform;

  @Column(name = "user_id")
  private String userId;

  @Lob
  @Column(name = "tags_json")
  private String tagsJson;

  @Column(name = "occurrence_id")
  private String occurrenceId;

  @Column(name = "event_ts", nullable = false)
  private Instant timestamp;

  @Column(name = "received_at", nullable = false)
  private Instant receivedAt;

  public EventRecordEntity() {}

  public String getEventId() {
    return eventId;
  }

  public void setEventId(String eventId) {
    this.eventId = eventId;
  }

  public Long getProjectId() {
    return projectId;
  }

  public void setProjectId(Long projectId) {
    this.projectId = projectId;
  }

  public Long getSubjectId() {
    return subjectId;
  }

  public void setSubjectId(Long subjectId) {
    this.subjectId = subjectId;
  }

  public String getEnvironment() {
    return environment;
  }

  public void setEnvironment(String environment) {
    this.environment = environment;
  }

  public String getLevel() {
    return level;
  }

  public void setLevel(String level) {
    this.level = level;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public String getPlatform() {
    return platform;
  }

  public void setPlatform(String platform) {
    this.platform = platform;
  }

  public String getUserId() {
    return userId;
  }

  public void setUserId(String userId) {
    this.userId = userId;
  }

  public String getTagsJson() {
    return tagsJson;
  }

  public void setTagsJson(String tagsJson) {
    this.tagsJson = tagsJson;
  }

  public String getOccurrenceId() {
    return occurrenceId;
  }

  public void setOccurrenceId(String occurrenceId) {
    this.occurrenceId = occurrenceId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(Instant timestamp) {
    this.timestamp = timestamp;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }

  public void setReceivedAt(Instant receivedAt) {
    this.receivedAt = receivedAt;
  }
}
