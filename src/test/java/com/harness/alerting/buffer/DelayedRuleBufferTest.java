package com.harness.alerting.buffer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.alerting.MutableClock;
import com.harness.alerting.enums.MatchMode;
import com.harness.alerting.enums.SubjectStatus;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.model.Subject;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DelayedRuleBufferTest {

  private static final long PROJECT_ID = 3L;
  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private InMemorySharedBuffer sharedBuffer;
  private DelayedRuleBuffer buffer;

  @BeforeEach
  void setUp() {
    sharedBuffer = new InMemorySharedBuffer();
    buffer = new DelayedRuleBuffer(sharedBuffer, new ObjectMapper().findAndRegisterModules(), new MutableClock(NOW));
  }

  @Test
  void laterEventForSameRuleAndSubjectReplacesPayload() {
    RuleDto rule = rule();
    buffer.enqueue(event("e1", 10L, NOW.minusSeconds(30)), rule);
    buffer.enqueue(event("e2", 10L, NOW.minusSeconds(10)), rule);

    DrainedBatch batch = buffer.drainProject(PROJECT_ID);

    assertThat(batch.entries()).singleElement().satisfies(entry -> {
      assertThat(entry.key()).isEqualTo(new BufferKey(rule.id(), 10L, Set.of(rule.id())));
      assertThat(entry.payload().eventId()).isEqualTo("e2");
      assertThat(entry.payload().timestamp()).isEqualTo(NOW.minusSeconds(10));
    });
    assertThat(buffer.pendingProjects(NOW)).containsExactly(PROJECT_ID);
  }

  @Test
  void undecodableEntriesAreSkippedButDeleted() {
    RuleDto rule = rule();
    buffer.enqueue(event("e1", 10L, NOW), rule);
    sharedBuffer.push(PROJECT_ID, "garbage", "{}");
    sharedBuffer.push(PROJECT_ID, new BufferKey(rule.id(), 11L, Set.of(rule.id())).encode(), "not json");

    DrainedBatch batch = buffer.drainProject(PROJECT_ID);
    buffer.delete(PROJECT_ID, batch);

    assertThat(batch.entries()).hasSize(1);
    assertThat(batch.raw()).hasSize(3);
    assertThat(sharedBuffer.readAll(PROJECT_ID)).isEmpty();
  }

  @Test
  void entriesWrittenAfterDrainSurviveDelete() {
    RuleDto rule = rule();
    buffer.enqueue(event("e1", 10L, NOW.minusSeconds(30)), rule);
    DrainedBatch batch = buffer.drainProject(PROJECT_ID);

    buffer.enqueue(event("e2", 10L, NOW), rule);
    buffer.delete(PROJECT_ID, batch);

    assertThat(buffer.drainProject(PROJECT_ID).entries())
        .extracting(entry -> entry.payload().eventId())
        .containsExactly("e2");
  }

  private RuleDto rule() {
    return new RuleDto(UUID.randomUUID(), PROJECT_ID, "rule", null, true, false, MatchMode.ALL, MatchMode.ALL, 60,
        List.of(), List.of(), NOW, NOW);
  }

  private AlertEvent event(String eventId, long subjectId, Instant timestamp) {
    return new AlertEvent(eventId, PROJECT_ID, new Subject(subjectId, PROJECT_ID, SubjectStatus.UNRESOLVED),
        "production", "error", "boom", "java", null, Map.of(), "occ-" + eventId, timestamp, timestamp);
  }
}
