package com.harness.alerting.notification;

import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LoggingNotificationService implements NotificationService {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationService.class);

  private final NotificationBuffer buffer;
  private final Clock clock;

  public LoggingNotificationService(NotificationBuffer buffer, Clock clock) {
    this.buffer = buffer;
    this.clock = clock;
  }

  @Override
  public void notifyEvent(AlertEvent event, List<RuleDto> rules, String target) {
    List<String> ruleNames = ruleNames(rules);
    log.warn(
        "NOTIFICATION FIRED: channel=event, projectId={}, subjectId={}, eventId={}, target={}, rules={}",
        event.projectId(),
        event.subjectId(),
        event.eventId(),
        target,
        ruleNames
    );

    Map<String, Object> details = baseDetails(event);
    details.put("target", target);
    buffer.push(new NotificationRecord(
        UUID.randomUUID().toString(),
        Instant.now(clock),
        "EVENT",
        event.projectId(),
        event.subjectId(),
        ruleNames,
        "Alert triggered by " + String.join(", ", ruleNames),
        details
    ));
  }

  @Override
  public void notifyEmail(AlertEvent event, List<RuleDto> rules, String targetType, String targetIdentifier) {
    List<String> ruleNames = ruleNames(rules);
    log.warn(
        "NOTIFICATION FIRED: channel=email, projectId={}, subjectId={}, eventId={}, targetType={}, targetIdentifier={}, rules={}",
        event.projectId(),
        event.subjectId(),
        event.eventId(),
        targetType,
        targetIdentifier,
        ruleNames
    );

    Map<String, Object> details = baseDetails(event);
    details.put("targetType", targetType);
    details.put("targetIdentifier", targetIdentifier);
    buffer.push(new NotificationRecord(
        UUID.randomUUID().toString(),
        Instant.now(clock),
        "EMAIL",
        event.projectId(),
        event.subjectId(),
        ruleNames,
        "Mail to " + targetType + ":" + targetIdentifier + " for " + String.join(", ", ruleNames),
        details
    ));
  }

  private List<String> ruleNames(List<RuleDto> rules) {
    return rules.stream().map(RuleDto::name).distinct().toList();
  }

  private Map<String, Object> baseDetails(AlertEvent event) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("eventId", event.eventId() != null ? event.eventId() : "N/A");
    details.put("environment", event.environment() != null ? event.environment() : "N/A");
    details.put("level", event.level() != null ? event.level() : "N/A");
    details.put("message", event.message() != null ? event.message() : "N/A");
    return details;
  }
}
