package com.harness.alerting.ratequery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class DuckDbRateQueryHandler implements RateQueryHandler {

  private static final Logger log = LoggerFactory.getLogger(DuckDbRateQueryHandler.class);

  private final RateQueryBuilder queryBuilder;
  private final String basePath;

  protected DuckDbRateQueryHandler(RateQueryBuilder queryBuilder, String basePath) {
    this.queryBuilder = queryBuilder;
    this.basePath = basePath;
  }

  protected abstract String aggregate();

  @Override
  public Map<Long, Double> getRatesBulk(Duration duration,
                                        Set<Long> subjectIds,
                                        String environment,
                                        Instant now,
                                        Duration comparisonInterval) throws Exception {
    Map<Long, Double> rates = new HashMap<>();
    for (Long subjectId : subjectIds) {
      rates.put(subjectId, 0.0);
    }
    if (subjectIds.isEmpty()) {
      return rates;
    }

    Instant windowEnd = comparisonInterval != null ? now.minus(comparisonInterval) : now;
    Instant windowStart = windowEnd.minus(duration);

    List<String> files = archiveFiles(windowStart, windowEnd);
    if (files.isEmpty()) {
      log.debug("kind={} no archive files between {} and {}", kind(), windowStart, windowEnd);
      return rates;
    }

    String sql = queryBuilder.buildRateQuery(aggregate(), files, subjectIds, environment, windowStart, windowEnd);
    log.debug("kind={} sql={}", kind(), sql);

    try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      while (rs.next()) {
        rates.put(rs.getLong(1), rs.getDouble(2));
      }
    }
    return rates;
  }

  List<String> archiveFiles(Instant windowStart, Instant windowEnd) throws IOException {
    Path base = Path.of(basePath);
    if (!Files.isDirectory(base)) {
      return List.of();
    }

    LocalDate startDate = windowStart.atZone(ZoneOffset.UTC).toLocalDate();
    LocalDate endDate = windowEnd.atZone(ZoneOffset.UTC).toLocalDate();

    List<Path> projectDirs;
    try (Stream<Path> dirs = Files.list(base)) {
      projectDirs = dirs
          .filter(Files::isDirectory)
          .filter(p -> p.getFileName().toString().startsWith("project_id="))
          .toList();
    }

    List<String> files = new ArrayList<>();
    for (Path projectDir : projectDirs) {
      for (LocalDate d = startDate; !d.isAfter(endDate); d = d.plusDays(1)) {
        Path dayDir = projectDir.resolve(String.format(
            "year=%04d/month=%02d/day=%02d", d.getYear(), d.getMonthValue(), d.getDayOfMonth()));
        if (!Files.isDirectory(dayDir)) {
          continue;
        }
        try (Stream<Path> dayFiles = Files.list(dayDir)) {
          dayFiles
              .filter(p -> p.getFileName().toString().endsWith(".jsonl"))
              .sorted()
              .forEach(p -> files.add(p.toString()));
        }
      }
    }
    return files;
  }
}
