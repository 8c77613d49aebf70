package com.harness.alerting.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "suppression_records",
    uniqueConstraints = @UniqueConstraint(name = "uq_suppression_rule_subject", columnNames = {"rule_id", "subject_id"})
)
public class SuppressionRecordEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "rule_id", nullable = false, updatable = false)
  private UUID ruleId;

  @Column(name = "subject_id", nullable = false, updatable = false)
  private Long subjectId;

  @Column(name = "last_active")
  private Instant lastActive;

  public SuppressionRecordEntity() {}

  public SuppressionRecordEntity(UUID ruleId, Long subjectId) {
    this.ruleId = ruleId;
    this.subjectId = subjectId;
  }

  public Long getId() {
    return id;
  }

  public UUID getRuleId() {
    return ruleId;
  }

  public Long getSubjectId() {
    return subjectId;
  }

  public Instant getLastActive() {
    return lastActive;
  }

  public void setLastActive(Instant lastActive) {
    this.lastActive = lastActive;
  }
}
