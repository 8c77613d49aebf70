package com.harness.alerting.buffer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DelayedRuleBuffer {

  private static final Logger log = LoggerFactory.getLogger(DelayedRuleBuffer.class);

  private final SharedBuffer buffer;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public DelayedRuleBuffer(SharedBuffer buffer, ObjectMapper objectMapper, Clock clock) {
    this.buffer = buffer;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public void enqueue(AlertEvent event, RuleDto rule) {
    BufferKey key = new BufferKey(rule.id(), event.subjectId(), Set.of(rule.id()));
    BufferPayload payload = new BufferPayload(event.eventId(), event.occurrenceId(), event.timestamp());
    String value;
    try {
      value = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize buffer payload", e);
    }
    buffer.push(event.projectId(), key.encode(), value);
    buffer.markPending(event.projectId(), Instant.now(clock));
    log.debug("Deferred rule: projectId={}, ruleId={}, subjectId={}, eventId={}",
        event.projectId(), rule.id(), event.subjectId(), event.eventId());
  }

  public void markPending(long projectId) {
    buffer.markPending(projectId, Instant.now(clock));
  }

  public DrainedBatch drainProject(long projectId) {
    Map<String, String> raw = buffer.readAll(projectId);
    List<BufferEntry> entries = new ArrayList<>(raw.size());
    for (Map.Entry<String, String> e : raw.entrySet()) {
      try {
        BufferKey key = BufferKey.decode(e.getKey());
        BufferPayload payload = decodePayload(e.getValue());
        entries.add(new BufferEntry(key, payload));
      } catch (IllegalArgumentException ex) {
        log.warn("Skipping undecodable buffer entry: projectId={}, field={}, reason={}",
            projectId, e.getKey(), ex.getMessage());
      }
    }
    return new DrainedBatch(entries, raw);
  }

  public void delete(long projectId, DrainedBatch batch) {
    if (!batch.isEmpty()) {
      buffer.delete(projectId, batch.raw());
    }
  }

  public Set<Long> pendingProjects(Instant upTo) {
    return buffer.pendingProjects(upTo);
  }

  public void removePending(Instant upTo) {
    buffer.removePending(upTo);
  }

  private BufferPayload decodePayload(String value) {
    BufferPayload payload;
    try {
      payload = objectMapper.readValue(value, BufferPayload.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed buffer payload", e);
    }
    if (payload == null || payload.eventId() == null || payload.eventId().isBlank()) {
      throw new IllegalArgumentException("Buffer payload has no event id");
    }
    return payload;
  }
}
