package com.harness.alerting.ratequery;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds the DuckDB query for one rate lookup. The window is {@code (start, end]} so the event
 * that anchors it is counted:
 * <pre>
 *   SELECT subject_id, {aggregate} FROM read_json([...]) WHERE event_ts in window
 *     AND subject_id IN (...) [AND environment = ...] GROUP BY subject_id
 * </pre>
 */
@Component
public class RateQueryBuilder {

  static final String COLUMNS = "{event_id: 'VARCHAR', project_id: 'BIGINT', subject_id: 'BIGINT', "
      + "environment: 'VARCHAR', user_id: 'VARCHAR', event_ts: 'BIGINT', received_at: 'BIGINT'}";

  public String buildRateQuery(String aggregate,
                               List<String> files,
                               Set<Long> subjectIds,
                               String environment,
                               Instant windowStart,
                               Instant windowEnd) {
    if (files.isEmpty()) {
      throw new IllegalArgumentException("At least one archive file is required");
    }
    if (subjectIds.isEmpty()) {
      throw new IllegalArgumentException("At least one subject id is required");
    }

    StringBuilder sb = new StringBuilder();
    sb.append("SELECT subject_id, ").append(aggregate).append(" AS value FROM read_json(");
    StringJoiner paths = new StringJoiner(", ", "[", "]");
    for (String file : files) {
      paths.add("'" + escapeSql(file) + "'");
    }
    sb.append(paths);
    sb.append(", format = 'newline_delimited', columns = ").append(COLUMNS).append(")");
    sb.append(" WHERE event_ts > ").append(windowStart.toEpochMilli());
    sb.append(" AND event_ts <= ").append(windowEnd.toEpochMilli());
    sb.append(" AND subject_id IN (")
        .append(subjectIds.stream().sorted().map(String::valueOf).collect(Collectors.joining(", ")))
        .append(")");
    if (environment != null) {
      sb.append(" AND environment = '").append(escapeSql(environment)).append("'");
    }
    sb.append(" GROUP BY subject_id");
    return sb.toString();
  }

  private String escapeSql(String value) {
    return value.replace("'", "''");
  }
}
