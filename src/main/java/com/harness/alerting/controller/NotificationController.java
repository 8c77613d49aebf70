package com.harness.alerting.controller;

import com.harness.alerting.notification.NotificationBuffer;
import com.harness.alerting.notification.NotificationRecord;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1")
public class NotificationController {

  private final NotificationBuffer buffer;

  public NotificationController(NotificationBuffer buffer) {
    this.buffer = buffer;
  }

  @GetMapping("/notifications")
  public ResponseEntity<List<NotificationRecord>> getRecent(
      @RequestParam(value = "projectId", required = false) Long projectId) {
    return ResponseEntity.ok(buffer.getRecent(projectId));
  }

  @GetMapping(value = "/notifications/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream() {
    return buffer.subscribe();
  }
}
