package com.harness.alerting.controller;

import com.harness.alerting.pipeline.archive.EventArchiveWriter;
import com.harness.alerting.ruleengine.delayed.DelayedRuleProcessor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects/{projectId}")
public class DelayedProcessingController {

  private final DelayedRuleProcessor processor;
  private final EventArchiveWriter archiveWriter;

  public DelayedProcessingController(DelayedRuleProcessor processor, EventArchiveWriter archiveWriter) {
    this.processor = processor;
    this.archiveWriter = archiveWriter;
  }

  @PostMapping("/delayed-processing")
  public ResponseEntity<ProcessingResponse> process(@PathVariable long projectId) {
    int archived = archiveWriter.flushAllFromQueue();
    processor.processProject(projectId);
    return ResponseEntity.ok(new ProcessingResponse(projectId, archived));
  }

  public record ProcessingResponse(long projectId, int archivedEvents) {}
}
