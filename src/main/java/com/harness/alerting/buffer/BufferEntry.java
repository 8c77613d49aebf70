package com.harness.alerting.buffer;

public record BufferEntry(BufferKey key, BufferPayload payload) {}
