package com.harness.alerting.service;

import com.harness.alerting.model.AlertEvent;
import com.harness.alerting.model.Subject;
import java.util.Optional;

/**
 * Lookup of previously ingested events, used to rebuild the triggering event of a deferred
 * decision.
 */
public interface EventStore {

  void save(AlertEvent event);

  /**
   * @return the event bound to {@code subject}, or empty if it is unknown in this project
   */
  Optional<AlertEvent> find(long projectId, String eventId, Subject subject);
}
