package com.harness.alerting.pipeline.queue;

import com.harness.alerting.model.AlertEvent;
import java.util.Collection;

public interface EventBus {

  /**
   * Publish an event to both the realtime and the archive queue.
   *
   * @return true if the event was accepted into the realtime queue,
   *         false if the realtime queue was full and the event was only
   *         archived.
   */
  boolean publish(IngestedEvent event);

  IngestedEvent takeRealtime() throws InterruptedException;

  /**
   * Move every event currently in the archive queue into {@code sink} without blocking.
   *
   * @return number of events moved
   */
  int drainArchive(Collection<? super AlertEvent> sink);

  int getRealtimeQueueSize();

  int getArchiveQueueSize();
}
