package com.harness.alerting.controller;

import com.harness.alerting.model.RuleDto;
import com.harness.alerting.model.RuleFireHistoryDto;
import com.harness.alerting.service.RuleFireHistoryService;
import com.harness.alerting.service.RuleService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/rules")
public class RuleController {

  private final RuleService ruleService;
  private final RuleFireHistoryService fireHistoryService;

  public RuleController(RuleService ruleService, RuleFireHistoryService fireHistoryService) {
    this.ruleService = ruleService;
    this.fireHistoryService = fireHistoryService;
  }

  @PostMapping
  public ResponseEntity<RuleDto> createRule(
      @PathVariable long projectId,
      @Valid @RequestBody RuleDto request) {
    RuleDto created = ruleService.createRule(projectId, request);
    return ResponseEntity
        .created(URI.create("/api/v1/projects/" + projectId + "/rules/" + created.id()))
        .body(created);
  }

  @GetMapping
  public ResponseEntity<List<RuleDto>> listRules(
      @PathVariable long projectId,
      @RequestParam(value = "enabled", required = false) Boolean enabled) {
    return ResponseEntity.ok(ruleService.listRules(projectId, enabled));
  }

  @GetMapping("/{ruleId}")
  public ResponseEntity<RuleDto> getRule(
      @PathVariable long projectId,
      @PathVariable UUID ruleId) {
    return ruleService.getRule(projectId, ruleId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PutMapping("/{ruleId}")
  public ResponseEntity<RuleDto> updateRule(
      @PathVariable long projectId,
      @PathVariable UUID ruleId,
      @Valid @RequestBody RuleDto request) {
    return ruleService.updateRule(projectId, ruleId, request)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{ruleId}")
  public ResponseEntity<Void> deleteRule(
      @PathVariable long projectId,
      @PathVariable UUID ruleId) {
    boolean deleted = ruleService.deleteRule(projectId, ruleId);
    return deleted ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @PatchMapping("/{ruleId}/enable")
  public ResponseEntity<RuleDto> enableRule(
      @PathVariable long projectId,
      @PathVariable UUID ruleId) {
    return ruleService.setRuleEnabled(projectId, ruleId, true)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PatchMapping("/{ruleId}/disable")
  public ResponseEntity<RuleDto> disableRule(
      @PathVariable long projectId,
      @PathVariable UUID ruleId) {
    return ruleService.setRuleEnabled(projectId, ruleId, false)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PatchMapping("/{ruleId}/snooze")
  public ResponseEntity<RuleDto> snoozeRule(
      @PathVariable long projectId,
      @PathVariable UUID ruleId) {
    return ruleService.setRuleSnoozed(projectId, ruleId, true)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PatchMapping("/{ruleId}/unsnooze")
  public ResponseEntity<RuleDto> unsnoozeRule(
      @PathVariable long projectId,
      @PathVariable UUID ruleId) {
    return ruleService.setRuleSnoozed(projectId, ruleId, false)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/{ruleId}/history")
  public ResponseEntity<List<RuleFireHistoryDto>> fireHistory(
      @PathVariable long projectId,
      @PathVariable UUID ruleId) {
    if (ruleService.getRule(projectId, ruleId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(fireHistoryService.listForRule(ruleId));
  }
}
