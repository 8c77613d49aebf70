package com.harness.alerting.buffer;

import java.util.List;
import java.util.Map;

// raw includes undecodable entries so they are deleted with the batch
public record DrainedBatch(List<BufferEntry> entries, Map<String, String> raw) {

  public boolean isEmpty() {
    return raw.isEmpty();
  }
}
