package com.harness.alerting.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "rules", indexes = @Index(name = "idx_rules_project", columnList = "project_id"))
public class RuleEntity {

  @Id
  @Column(name = "id", nullable = false, updatable = false)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private Long projectId;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "environment")
  private String environment;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @Column(name = "snoozed", nullable = false)
  private boolean snoozed;

  @Column(name = "action_match", nullable = false, length = 16)
  private String actionMatch;

  @Column(name = "filter_match", nullable = false, length = 16)
  private String filterMatch;

  @Column(name = "frequency_minutes", nullable = false)
  private int frequencyMinutes;

  @Lob
  @Column(name = "conditions_json", nullable = false)
  private String conditionsJson;

  @Lob
  @Column(name = "actions_json", nullable = false)
  private String actionsJson;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public RuleEntity() {}

  public UUID getId() {
    return id;
  }

  public void setId(UUID id) {
    this.id = id;
  }

  public Long getProjectId() {
    return projectId;
  }

  public void setProjectId(Long projectId) {
    this.projectId = projectId;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getEnvironment() {
    return environment;
  }

  public void setEnvironment(String environment) {
    this.environment = environment;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isSnoozed() {
    return snoozed;
  }

  public void setSnoozed(boolean snoozed) {
    this.snoozed = snoozed;
  }

  public String getActionMatch() {
    return actionMatch;
  }

  public void setActionMatch(String actionMatch) {
    this.actionMatch = actionMatch;
  }

  public String getFilterMatch() {
    return filterMatch;
  }

  public void setFilterMatch(String filterMatch) {
    this.filterMatch = filterMatch;
  }

  public int getFrequencyMinutes() {
    return frequencyMinutes;
  }

  public void setFrequencyMinutes(int frequencyMinutes) {
    this.frequencyMinutes = frequencyMinutes;
  }

  public String getConditionsJson() {
    return conditionsJson;
  }

  public void setConditionsJson(String conditionsJson) {
    this.conditionsJson = conditionsJson;
  }

  public String getActionsJson() {
    return actionsJson;
  }

  public void setActionsJson(String actionsJson) {
    this.actionsJson = actionsJson;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
