package com.harness.alerting.ruleengine.action;

import com.harness.alerting.model.ActionSpec;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.notification.NotificationService;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class NotifyEmailAction implements ActionHandler {

  private static final Set<String> TARGET_TYPES = Set.of("team", "member", "owners");

  private final NotificationService notificationService;
  private final ActionCallback callback = this::send;

  public NotifyEmailAction(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @Override
  public String kind() {
    return "notify_email";
  }

  @Override
  public void validate(Map<String, Object> params) {
    Object targetType = params.get("targetType");
    if (targetType == null || !TARGET_TYPES.contains(targetType.toString())) {
      throw new IllegalArgumentException("notify_email targetType must be one of " + TARGET_TYPES);
    }
    if (!"owners".equals(targetType.toString()) && params.get("targetIdentifier") == null) {
      throw new IllegalArgumentException("notify_email targetIdentifier is required for " + targetType);
    }
  }

  @Override
  public List<ActionFuture> after(AlertEvent event, RuleDto rule, ActionSpec action) {
    String targetType = String.valueOf(action.params().get("targetType"));
    String targetIdentifier = String.valueOf(action.params().getOrDefault("targetIdentifier", ""));
    return List.of(new ActionFuture("mail:" + targetType + ":" + targetIdentifier, callback, rule, action.params()));
  }

  private void send(AlertEvent event, List<ActionFuture> futures) {
    Map<String, Object> kwargs = futures.get(0).kwargs();
    notificationService.notifyEmail(
        event,
        futures.stream().map(ActionFuture::rule).toList(),
        String.valueOf(kwargs.get("targetType")),
        String.valueOf(kwargs.getOrDefault("targetIdentifier", ""))
    );
  }
}
