package com.harness.alerting.pipeline.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.pipeline.queue.EventBus;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class EventArchiveWriter {

  private static final Logger log = LoggerFactory.getLogger(EventArchiveWriter.class);

  private final EventBus eventBus;
  private final ObjectMapper objectMapper;
  private final String basePath;

  public EventArchiveWriter(EventBus eventBus,
                            ObjectMapper objectMapper,
                            @Value("${alerting.archive.base-path:/tmp/alerting-engine/events}") String basePath) {
    this.eventBus = eventBus;
    this.objectMapper = objectMapper;
    this.basePath = basePath;
  }

  public int flushAllFromQueue() {
    List<AlertEvent> drained = new ArrayList<>();
    eventBus.drainArchive(drained);
    if (drained.isEmpty()) {
      return 0;
    }

    int written = 0;
    int fileCount = 0;
    for (Map.Entry<String, List<AlertEvent>> entry : groupByProjectAndDate(drained).entrySet()) {
      String partitionPath = entry.getKey();
      List<AlertEvent> events = entry.getValue();
      try {
        writePartition(partitionPath, events);
        written += events.size();
        fileCount++;
      } catch (IOException e) {
        log.error("Failed to write archive file for partition {}", partitionPath, e);
      }
    }

    log.info("EventArchiveWriter flushed {} events into {} file(s)", written, fileCount);
    return written;
  }

  private Map<String, List<AlertEvent>> groupByProjectAndDate(List<AlertEvent> events) {
    Map<String, List<AlertEvent>> byPartition = new HashMap<>();
    for (AlertEvent event : events) {
      ZonedDateTime zdt = eventTime(event).atZone(ZoneOffset.UTC);
      String partition = String.format(
          "%s/project_id=%d/year=%04d/month=%02d/day=%02d",
          basePath,
          event.projectId(),
          zdt.getYear(),
          zdt.getMonthValue(),
          zdt.getDayOfMonth()
      );
      byPartition.computeIfAbsent(partition, k -> new ArrayList<>()).add(event);
    }
    return byPartition;
  }

  private void writePartition(String partitionDir, List<AlertEvent> events) throws IOException {
    Files.createDirectories(Path.of(partitionDir));
    String fileName = "events-" + System.currentTimeMillis() + "-" + UUID.randomUUID() + ".jsonl";
    Path outputPath = Path.of(partitionDir, fileName);

    try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
      for (AlertEvent event : events) {
        writer.write(objectMapper.writeValueAsString(toRecord(event)));
        writer.newLine();
      }
    }
  }

  private Instant eventTime(AlertEvent event) {
    return event.timestamp() != null ? event.timestamp() : event.receivedAt();
  }

  static Map<String, Object> toRecord(AlertEvent event) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("event_id", event.eventId());
    record.put("project_id", event.projectId());
    record.put("subject_id", event.subjectId());
    record.put("environment", event.environment());
    record.put("user_id", event.userId());
    record.put("event_ts", (event.timestamp() != null ? event.timestamp() : event.receivedAt()).toEpochMilli());
    record.put("received_at", event.receivedAt() != null ? event.receivedAt().toEpochMilli() : null);
    return record;
  }
}
