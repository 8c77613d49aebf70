package com.harness.alerting.ruleengine.action;

import com.harness.alerting.enums.MatchMode;
import com.harness.alerting.enums.SubjectStatus;
import com.harness.alerting.model.ActionSpec;
import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.model.Subject;
import com.harness.alerting.notification.NotificationService;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class NotifyEmailActionTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private final NotificationService notificationService = mock(NotificationService.class);
  private final NotifyEmailAction action = new NotifyEmailAction(notificationService);

  @Test
  void validateChecksTargets() {
    assertThatCode(() -> action.validate(Map.of("targetType", "owners"))).doesNotThrowAnyException();
    assertThatCode(() -> action.validate(Map.of("targetType", "team", "targetIdentifier", "backend")))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> action.validate(Map.of("targetType", "member")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> action.validate(Map.of("targetType", "channel", "targetIdentifier", "x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rulesMailingTheSameTeamGetOneEmail() throws Exception {
    AlertEvent event = new AlertEvent("e1", 1L, new Subject(5L, 1L, SubjectStatus.UNRESOLVED), "production",
        "error", "boom", "java", null, Map.of(), null, NOW, NOW);
    RuleDto first = rule("first");
    RuleDto second = rule("second");
    ActionSpec spec = new ActionSpec("notify_email", Map.of("targetType", "team", "targetIdentifier", "backend"));

    List<ActionFuture> futures = new ArrayList<>();
    futures.addAll(action.after(event, first, spec));
    futures.addAll(action.after(event, second, spec));
    List<DispatchGroup> groups = ActionFutureGrouper.group(futures);

    assertThat(groups).singleElement();
    assertThat(futures.get(0).key()).isEqualTo("mail:team:backend");
    groups.get(0).callback().invoke(event, groups.get(0).futures());
    verify(notificationService).notifyEmail(eq(event), eq(List.of(first, second)), eq("team"), eq("backend"));
  }

  private RuleDto rule(String name) {
    return new RuleDto(UUID.randomUUID(), 1L, name, null, true, false, MatchMode.ALL, MatchMode.ALL, 60,
        List.of(), List.of(), NOW, NOW);
  }
}
