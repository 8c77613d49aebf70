package com.harness.alerting.buffer;

import java.time.Instant;

public record BufferPayload(String eventId, String occurrenceId, Instant timestamp) {}
