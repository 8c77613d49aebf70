package com.harness.alerting.pipeline.queue;

import com.harness.alerting.model.AlertEvent;
import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

public class InMemoryEventBus implements EventBus {

  private final BlockingQueue<IngestedEvent> realtimeQueue;
  private final BlockingQueue<AlertEvent> archiveQueue;

  public InMemoryEventBus(int realtimeCapacity, int archiveCapacity) {
    this.realtimeQueue = new LinkedBlockingQueue<>(realtimeCapacity);
    this.archiveQueue = new LinkedBlockingQueue<>(archiveCapacity);
  }

  @Override
  public boolean publish(IngestedEvent event) {
    boolean acceptedRealtime = realtimeQueue.offer(event);
    try {
      archiveQueue.put(event.event());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while enqueuing event to archive queue", e);
    }
    return acceptedRealtime;
  }

  @Override
  public IngestedEvent takeRealtime() throws InterruptedException {
    return realtimeQueue.take();
  }

  @Override
  public int drainArchive(Collection<? super AlertEvent> sink) {
    return archiveQueue.drainTo(sink);
  }

  @Override
  public int getRealtimeQueueSize() {
    return realtimeQueue.size();
  }

  @Override
  public int getArchiveQueueSize() {
    return archiveQueue.size();
  }
}
