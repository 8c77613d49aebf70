package com.harness.alerting.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SuppressionRecordRepository extends JpaRepository<SuppressionRecordEntity, Long> {

  List<SuppressionRecordEntity> findBySubjectIdAndRuleIdIn(Long subjectId, Collection<UUID> ruleIds);

  /**
   * Claims the cooldown slot: updates {@code lastActive} only if the record has never fired or
   * last fired at or before {@code threshold}.
   *
   * @return number of rows updated, 0 or 1
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update SuppressionRecordEntity s set s.lastActive = :now "
      + "where s.ruleId = :ruleId and s.subjectId = :subjectId "
      + "and (s.lastActive is null or s.lastActive <= :threshold)")
  int markActiveIfCooledDown(@Param("ruleId") UUID ruleId,
                             @Param("subjectId") Long subjectId,
                             @Param("now") Instant now,
                             @Param("threshold") Instant threshold);
}
