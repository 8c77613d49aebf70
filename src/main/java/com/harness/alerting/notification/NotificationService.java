package com.harness.alerting.notification;

import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import java.util.List;

public interface NotificationService {

  /**
   * One notification for an event on behalf of every rule that targeted the same destination.
   */
  void notifyEvent(AlertEvent event, List<RuleDto> rules, String target);

  void notifyEmail(AlertEvent event, List<RuleDto> rules, String targetType, String targetIdentifier);
}
