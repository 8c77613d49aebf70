package com.harness.alerting.pipeline.delayed;

import com.harness.alerting.buffer.DelayedRuleBuffer;
import com.harness.alerting.pipeline.archive.EventArchiveWriter;
import com.harness.alerting.ruleengine.delayed.DelayedRuleProcessor;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DelayedProcessingScheduler {

  private static final Logger log = LoggerFactory.getLogger(DelayedProcessingScheduler.class);

  private final DelayedRuleBuffer buffer;
  private final DelayedRuleProcessor processor;
  private final EventArchiveWriter archiveWriter;
  private final Clock clock;

  public DelayedProcessingScheduler(DelayedRuleBuffer buffer,
                                    DelayedRuleProcessor processor,
                                    EventArchiveWriter archiveWriter,
                                    Clock clock) {
    this.buffer = buffer;
    this.processor = processor;
    this.archiveWriter = archiveWriter;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${alerting.delayed.interval-ms:60000}")
  public void runDelayedProcessing() {
    try {
      processPending();
    } catch (Exception e) {
      log.error("Delayed processing run failed", e);
    }
  }

  public int processPending() {
    archiveWriter.flushAllFromQueue();

    Instant upTo = Instant.now(clock);
    Set<Long> projects = buffer.pendingProjects(upTo);
    if (projects.isEmpty()) {
      log.debug("No projects with pending delayed work");
      return 0;
    }
    buffer.removePending(upTo);

    log.info("Running delayed processing: projects={}", projects.size());
    for (Long projectId : projects) {
      processor.processProject(projectId);
    }
    return projects.size();
  }
}
