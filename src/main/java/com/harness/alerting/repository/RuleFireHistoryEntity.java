package com.harness.alerting.repository;

import com.harness.alerting.enums.FirePath;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "rule_fire_history", indexes = @Index(name = "idx_fire_history_rule", columnList = "rule_id, fired_at"))
public class RuleFireHistoryEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "rule_id", nullable = false, updatable = false)
  private UUID ruleId;

  @Column(name = "project_id", nullable = false, updatable = false)
  private Long projectId;

  @Column(name = "subject_id", nullable = false, updatable = false)
  private Long subjectId;

  @Column(name = "event_id", updatable = false, length = 64)
  private String eventId;

  @Column(name = "notification_uuid", nullable = false, updatable = false)
  private UUID notificationUuid;

  @Enumerated(EnumType.STRING)
  @Column(name = "path", nullable = false, updatable = false, length = 16)
  private FirePath path;

  @Column(name = "fired_at", nullable = false, updatable = false)
  private Instant firedAt;

  public RuleFireHistoryEntity() {}

  public Long getId() {
    return id;
  }

  public UUID getRuleId() {
    return ruleId;
  }

  public void setRuleId(UUID ruleId) {
    this.ruleId = ruleId;
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

  public String getEventId() {
    return eventId;
  }

  public void setEventId(String eventId) {
    this.eventId = eventId;
  }

  public UUID getNotificationUuid() {
    return notificationUuid;
  }

  public void setNotificationUuid(UUID notificationUuid) {
    this.notificationUuid = notificationUuid;
  }

  public FirePath getPath() {
    return path;
  }

  public void setPath(FirePath path) {
    this.path = path;
  }

  public Instant getFiredAt() {
    return firedAt;
  }

  public void setFiredAt(Instant firedAt) {
    this.firedAt = firedAt;
  }
}
