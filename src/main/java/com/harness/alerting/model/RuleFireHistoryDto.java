package com.harness.alerting.model;

import com.harness.alerting.enums.FirePath;
import java.time.Instant;
import java.util.UUID;

public record RuleFireHistoryDto(
    UUID ruleId,
    long subjectId,
    String eventId,
    UUID notificationUuid,
    FirePath path,
    Instant firedAt
) {}
