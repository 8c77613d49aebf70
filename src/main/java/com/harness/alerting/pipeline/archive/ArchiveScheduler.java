package com.harness.alerting.pipeline.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ArchiveScheduler {

  private static final Logger log = LoggerFactory.getLogger(ArchiveScheduler.class);

  private final EventArchiveWriter archiveWriter;

  public ArchiveScheduler(EventArchiveWriter archiveWriter) {
    this.archiveWriter = archiveWriter;
  }

  @Scheduled(fixedDelayString = "${alerting.archive.flush-interval-ms:60000}")
  public void flushArchiveQueue() {
    log.debug("Running scheduled archive flush");
    archiveWriter.flushAllFromQueue();
  }
}
