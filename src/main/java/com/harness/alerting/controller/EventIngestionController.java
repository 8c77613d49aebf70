package com.harness.alerting.controller;

import com.harness.alerting.model.EventIngestRequest;
import com.harness.alerting.service.EventIngestionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects/{projectId}")
public class EventIngestionController {

  private final EventIngestionService ingestionService;

  public EventIngestionController(EventIngestionService ingestionService) {
    this.ingestionService = ingestionService;
  }

  @PostMapping("/events")
  public ResponseEntity<EventResponse> ingestSingle(
      @PathVariable long projectId,
      @Valid @RequestBody EventIngestRequest request
  ) {
    String eventId = ingestionService.ingestEvent(projectId, request);
    return ResponseEntity
        .status(HttpStatus.ACCEPTED)
        .body(new EventResponse(eventId));
  }

  public record EventResponse(String eventId) {}
}
