package com.harness.alerting.ruleengine.action;

import com.harness.alerting.model.ActionSpec;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.notification.NotificationService;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class NotifyEventAction implements ActionHandler {

  static final String DEFAULT_TARGET = "default";

  private final NotificationService notificationService;
  private final ActionCallback callback = this::send;

  public NotifyEventAction(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @Override
  public String kind() {
    return "notify_event";
  }

  @Override
  public List<ActionFuture> after(AlertEvent event, RuleDto rule, ActionSpec action) {
    String target = target(action);
    return List.of(new ActionFuture("notify_event:" + target, callback, rule, action.params()));
  }

  private void send(AlertEvent event, List<ActionFuture> futures) {
    String target = futures.get(0).kwargs().getOrDefault("target", DEFAULT_TARGET).toString();
    notificationService.notifyEvent(event, futures.stream().map(ActionFuture::rule).toList(), target);
  }

  private String target(ActionSpec action) {
    Object target = action.params().get("target");
    return target == null || target.toString().isBlank() ? DEFAULT_TARGET : target.toString();
  }
}
