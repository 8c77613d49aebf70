package com.harness.alerting.controller;

import com.harness.alerting.enums.SubjectStatus;
import com.harness.alerting.model.Subject;
import com.harness.alerting.service.SubjectService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/subjects")
public class SubjectController {

  private final SubjectService subjectService;

  public SubjectController(SubjectService subjectService) {
    this.subjectService = subjectService;
  }

  @GetMapping("/{subjectId}")
  public ResponseEntity<Subject> getSubject(
      @PathVariable long projectId,
      @PathVariable long subjectId) {
    return subjectService.find(projectId, subjectId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PatchMapping("/{subjectId}/status")
  public ResponseEntity<Subject> updateStatus(
      @PathVariable long projectId,
      @PathVariable long subjectId,
      @Valid @RequestBody StatusRequest request) {
    return subjectService.updateStatus(projectId, subjectId, request.status())
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  public record StatusRequest(@NotNull SubjectStatus status) {}
}
