package com.ragmod.moderation.loadtest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/** Writes load-test results as pretty-printed JSON files named by run timestamp. */
@Slf4j
public class LoadTestReportWriter {

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public LoadTestReportWriter(ObjectMapper objectMapper) {
    this(objectMapper, Clock.systemDefaultZone());
  }

  LoadTestReportWriter(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** Writes {@code load_test_<timestamp>.json} holding the run configuration and every level. */
  public Path writeRun(Path outputDir, Map<String, Object> config, List<LoadTestMetrics> results)
      throws IOException {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("test_config", config);
    document.put("results", results);
    return write(outputDir, "load_test_", document);
  }

  /** Writes {@code scaling_report_<timestamp>.json}: levels in the order run plus the peak. */
  public Path writeScalingReport(
      Path outputDir, Map<String, Object> config, List<LoadTestMetrics> results)
      throws IOException {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("test_config", config);
    document.put("scaling_results", results);
    LoadHarness.peakThroughput(results)
        .ifPresent(
            peak -> {
              document.put("peak_throughput_concurrency", peak.getConcurrencyLevel());
              document.put("peak_requests_per_second", peak.getRequestsPerSecond());
            });
    return write(outputDir, "scaling_report_", document);
  }

  private Path write(Path outputDir, String prefix, Object document) throws IOException {
    Files.createDirectories(outputDir);
    Path file = outputDir.resolve(prefix + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".json");
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), document);
    log.info("Results saved to {}", file);
    return file;
  }
}
