package com.harness.alerting.service;

import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.EventIngestRequest;
import com.harness.alerting.model.Subject;
import com.harness.alerting.pipeline.queue.EventBus;
import com.harness.alerting.pipeline.queue.IngestedEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EventIngestionService {

  private static final Logger log = LoggerFactory.getLogger(EventIngestionService.class);

  private final SubjectService subjectService;
  private final EventStore eventStore;
  private final EventBus eventBus;
  private final Clock clock;

  public EventIngestionService(SubjectService subjectService, EventStore eventStore, EventBus eventBus, Clock clock) {
    this.subjectService = subjectService;
    this.eventStore = eventStore;
    this.eventBus = eventBus;
    this.clock = clock;
  }

  public String ingestEvent(long projectId, EventIngestRequest request) {
    Instant now = Instant.now(clock);
    Instant timestamp = request.timestamp() != null ? request.timestamp() : now;
    Subject subject = subjectService.getOrCreate(projectId, request.subjectId(), timestamp);

    String eventId = request.eventId() != null && !request.eventId().isBlank()
        ? request.eventId()
        : UUID.randomUUID().toString();
    AlertEvent event = new AlertEvent(
        eventId,
        projectId,
        subject,
        request.environment(),
        request.level(),
        request.message(),
        request.platform(),
        request.userId(),
        request.tags() != null ? new HashMap<>(request.tags()) : Map.of(),
        request.occurrenceId(),
        timestamp,
        now
    );
    eventStore.save(event);

    boolean acceptedRealtime = eventBus.publish(new IngestedEvent(event, request.toState()));
    if (!acceptedRealtime) {
      log.warn("Realtime queue full, event archived only. projectId={}, eventId={}", projectId, eventId);
    }
    return eventId;
  }
}
