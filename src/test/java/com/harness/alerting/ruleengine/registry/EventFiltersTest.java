package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.enums.MatchOperator;
import com.harness.alerting.enums.SubjectStatus;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.EventState;
import com.harness.alerting.model.Subject;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventFiltersTest {

  private final LevelFilter levelFilter = new LevelFilter();
  private final TaggedEventFilter taggedEventFilter = new TaggedEventFilter();
  private final EventAttributeFilter attributeFilter = new EventAttributeFilter();

  @Test
  void levelFilterComparesSeverity() {
    AlertEvent warning = event("warning", Map.of());

    assertThat(levelFilter.passes(warning, Map.of("match", "gte", "level", "info"), EventState.none())).isTrue();
    assertThat(levelFilter.passes(warning, Map.of("match", "gte", "level", "error"), EventState.none())).isFalse();
    assertThat(levelFilter.passes(warning, Map.of("match", "eq", "level", "WARNING"), EventState.none())).isTrue();
    assertThat(levelFilter.passes(warning, Map.of("match", "lte", "level", "debug"), EventState.none())).isFalse();
  }

  @Test
  void levelFilterRejectsEventsWithoutLevel() {
    assertThat(levelFilter.passes(event(null, Map.of()), Map.of("match", "gte", "level", "debug"), EventState.none()))
        .isFalse();
  }

  @Test
  void levelFilterValidatesParameters() {
    assertThatThrownBy(() -> levelFilter.validate(Map.of("match", "gte", "level", "critical")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> levelFilter.validate(Map.of("match", "gt", "level", "error")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void taggedEventFilterMatchesTagValues() {
    AlertEvent event = event("error", Map.of("browser", "Firefox 118", "region", "eu"));

    assertThat(taggedEventFilter.passes(event, Map.of("key", "browser", "match", "sw", "value", "firefox"),
        EventState.none())).isTrue();
    assertThat(taggedEventFilter.passes(event, Map.of("key", "region", "match", "ne", "value", "eu"),
        EventState.none())).isFalse();
    assertThat(taggedEventFilter.passes(event, Map.of("key", "release", "match", "ns"), EventState.none())).isTrue();
    assertThat(taggedEventFilter.passes(event, Map.of("key", "release", "match", "eq", "value", "1.0"),
        EventState.none())).isFalse();
  }

  @Test
  void attributeFilterReadsTopLevelFields() {
    AlertEvent event = event("error", Map.of());

    assertThat(attributeFilter.passes(event, Map.of("attribute", "message", "match", "co", "value", "timeout"),
        EventState.none())).isTrue();
    assertThat(attributeFilter.passes(event, Map.of("attribute", "platform", "match", "re", "value", "^jav"),
        EventState.none())).isTrue();
    assertThatThrownBy(() -> attributeFilter.passes(event,
        Map.of("attribute", "stacktrace", "match", "is"), EventState.none()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void invalidRegexDoesNotMatch() {
    assertThat(new AttributeMatcher().matches(
        MatchOperator.REGEX_MATCH, "abc", "(unclosed")).isFalse();
  }

  @Test
  void stateTransitionConditionReadsItsFlag() {
    StateTransitionCondition regression = new StateTransitionCondition("regression_event", EventState::isRegression);

    assertThat(regression.passes(event("error", Map.of()), Map.of(), new EventState(false, true, false, false, false)))
        .isTrue();
    assertThat(regression.passes(event("error", Map.of()), Map.of(), EventState.none())).isFalse();
  }

  private AlertEvent event(String level, Map<String, String> tags) {
    Instant now = Instant.parse("2026-03-10T12:00:00Z");
    return new AlertEvent("e1", 1L, new Subject(5L, 1L, SubjectStatus.UNRESOLVED), "production", level,
        "Gateway Timeout calling payments", "java", "user-1", tags, null, now, now);
  }
}
