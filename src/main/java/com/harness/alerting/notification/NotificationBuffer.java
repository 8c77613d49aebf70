package com.harness.alerting.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Component
public class NotificationBuffer {

  private static final Logger log = LoggerFactory.getLogger(NotificationBuffer.class);

  private final Deque<NotificationRecord> recent = new ConcurrentLinkedDeque<>();
  private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
  private final ObjectMapper objectMapper;
  private final int maxSize;

  public NotificationBuffer(ObjectMapper objectMapper,
                            @Value("${alerting.notifications.max-recent:100}") int maxSize) {
    this.objectMapper = objectMapper;
    this.maxSize = maxSize;
  }

  public void push(NotificationRecord record) {
    recent.addFirst(record);
    while (recent.size() > maxSize) {
      recent.pollLast();
    }
    broadcast(record);
  }

  public List<NotificationRecord> getRecent() {
    return new ArrayList<>(recent);
  }

  public List<NotificationRecord> getRecent(Long projectId) {
    if (projectId == null) {
      return getRecent();
    }
    return recent.stream()
        .filter(record -> record.projectId() == projectId)
        .toList();
  }

  public SseEmitter subscribe() {
    SseEmitter emitter = new SseEmitter(0L);
    emitters.add(emitter);
    emitter.onCompletion(() -> emitters.remove(emitter));
    emitter.onTimeout(() -> emitters.remove(emitter));
    emitter.onError(e -> emitters.remove(emitter));
    return emitter;
  }

  private void broadcast(NotificationRecord record) {
    if (emitters.isEmpty()) {
      return;
    }
    String json;
    try {
      json = objectMapper.writeValueAsString(record);
    } catch (IOException e) {
      log.error("Failed to serialize notification id={}", record.id(), e);
      return;
    }

    for (SseEmitter emitter : emitters) {
      try {
        emitter.send(SseEmitter.event().name("notification").data(json));
      } catch (Exception e) {
        log.debug("Dropping SSE subscriber after send failure: {}", e.getMessage());
        emitters.remove(emitter);
      }
    }
  }
}
