package com.harness.alerting.pipeline.delayed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alerting.MutableClock;
import com.harness.alerting.buffer.DelayedRuleBuffer;
import com.harness.alerting.buffer.InMemorySharedBuffer;
import com.harness.alerting.pipeline.archive.EventArchiveWriter;
import com.harness.alerting.ruleengine.delayed.DelayedRuleProcessor;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DelayedProcessingSchedulerTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private InMemorySharedBuffer sharedBuffer;
  private DelayedRuleProcessor processor;
  private EventArchiveWriter archiveWriter;
  private DelayedProcessingScheduler scheduler;

  @BeforeEach
  void setUp() {
    MutableClock clock = new MutableClock(NOW);
    sharedBuffer = new InMemorySharedBuffer();
    DelayedRuleBuffer buffer = new DelayedRuleBuffer(sharedBuffer, new ObjectMapper(), clock);
    processor = mock(DelayedRuleProcessor.class);
    archiveWriter = mock(EventArchiveWriter.class);
    scheduler = new DelayedProcessingScheduler(buffer, processor, archiveWriter, clock);
  }

  @Test
  void flushesArchiveThenProcessesEachDueProject() {
    sharedBuffer.markPending(1L, NOW.minusSeconds(30));
    sharedBuffer.markPending(2L, NOW);
    sharedBuffer.markPending(3L, NOW.plusSeconds(30));

    assertThat(scheduler.processPending()).isEqualTo(2);

    InOrder order = inOrder(archiveWriter, processor);
    order.verify(archiveWriter).flushAllFromQueue();
    order.verify(processor).processProject(1L);
    verify(processor).processProject(2L);
    verify(processor, never()).processProject(3L);
    assertThat(sharedBuffer.pendingProjects(NOW)).isEmpty();
    assertThat(sharedBuffer.pendingProjects(NOW.plusSeconds(30))).containsExactly(3L);
  }

  @Test
  void nothingPendingProcessesNothing() {
    assertThat(scheduler.processPending()).isZero();

    verify(archiveWriter).flushAllFromQueue();
    verify(processor, never()).processProject(anyLong());
  }
}
