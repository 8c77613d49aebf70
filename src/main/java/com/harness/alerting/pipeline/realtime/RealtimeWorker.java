package com.harness.alerting.pipeline.realtime;

import com.harness.alerting.pipeline.queue.EventBus;
import com.harness.alerting.pipeline.queue.IngestedEvent;
import com.harness.alerting.ruleengine.action.ActionDispatcher;
import com.harness.alerting.ruleengine.action.DispatchGroup;
import com.harness.alerting.ruleengine.processor.RuleProcessor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RealtimeWorker implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(RealtimeWorker.class);

  private final EventBus eventBus;
  private final RuleProcessor ruleProcessor;
  private final ActionDispatcher dispatcher;

  private volatile boolean running = true;

  public RealtimeWorker(EventBus eventBus, RuleProcessor ruleProcessor, ActionDispatcher dispatcher) {
    this.eventBus = eventBus;
    this.ruleProcessor = ruleProcessor;
    this.dispatcher = dispatcher;
  }

  @Override
  public void run() {
    log.info("RealtimeWorker started");
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        IngestedEvent ingested = eventBus.takeRealtime();
        List<DispatchGroup> groups = ruleProcessor.evaluate(ingested.event(), ingested.state());
        if (!groups.isEmpty()) {
          dispatcher.dispatch(ingested.event(), groups);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (Exception e) {
        log.error("Error in RealtimeWorker loop", e);
      }
    }
    log.info("RealtimeWorker stopped");
  }

  public void shutdown() {
    this.running = false;
  }
}
