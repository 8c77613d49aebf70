package com.harness.alerting.ruleengine.action;

import com.harness.alerting.model.AlertEvent;
import java.util.List;

@FunctionalInterface
public interface ActionCallback {

  void invoke(AlertEvent event, List<ActionFuture> futures) throws Exception;
}
