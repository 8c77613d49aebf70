package com.harness.alerting.pipeline.queue;

import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.EventState;

public record IngestedEvent(AlertEvent event, EventState state) {}
