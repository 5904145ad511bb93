package com.ragmod.moderation.loadtest;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.service.corpus.CorpusLoader;
import com.ragmod.moderation.service.corpus.CorpusRecord;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: loadtest
 *
 * <p>Loads a JSONL corpus, checks the server's health, then runs one load test per requested
 * concurrency level and writes the results as JSON.
 */
@Slf4j
@Command(
    name = "loadtest",
    mixinStandardHelpOptions = true,
    description = "Measure throughput, latency and accuracy of a running classifier")
@Component
public class LoadTestCommand implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;

  @Option(
      names = "--server-url",
      defaultValue = "http://localhost:8000",
      description = "Classifier base URL (default: ${DEFAULT-VALUE})")
  String serverUrl;

  @Option(names = "--input-file", required = true, description = "JSONL corpus of texts to send")
  Path inputFile;

  @Option(
      names = "--concurrency",
      split = ",",
      defaultValue = "10",
      description = "Concurrency level, or a comma-separated list for a scaling sweep")
  List<Integer> concurrency;

  @Option(names = "--duration", defaultValue = "60", description = "Seconds per level")
  int durationSeconds;

  @Option(names = "--ramp-up", defaultValue = "5", description = "Seconds to reach full concurrency")
  int rampUpSeconds;

  @Option(names = "--cooldown", defaultValue = "10", description = "Seconds between levels")
  int cooldownSeconds;

  @Option(names = "--num-samples", description = "Draw this many items from the corpus")
  Integer numSamples;

  @Option(names = "--stratified", description = "Sample proportionally per category")
  boolean stratified;

  @Option(names = "--num-examples", defaultValue = "3", description = "Examples per prompt")
  int numExamples;

  @Option(names = "--max-text-length", defaultValue = "2000", description = "Text cap per request")
  int maxTextLength;

  @Option(names = "--request-timeout", defaultValue = "60", description = "Seconds per request")
  int requestTimeoutSeconds;

  @Option(names = "--rate", defaultValue = "0", description = "Max requests per second, 0 for none")
  double rate;

  @Option(names = "--api-key", description = "Value for the X-API-Key header")
  String apiKey;

  @Option(
      names = "--output-dir",
      defaultValue = "load_test_results",
      description = "Where result files go (default: ${DEFAULT-VALUE})")
  Path outputDir;

  @Option(names = "--seed", description = "Random seed for sampling and item selection")
  Long seed;

  private final CorpusLoader corpusLoader;
  private final ObjectMapper objectMapper;
  private final ModerationProperties properties;

  public LoadTestCommand(
      CorpusLoader corpusLoader, ObjectMapper objectMapper, ModerationProperties properties) {
    this.corpusLoader = corpusLoader;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public Integer call() {
    ConsoleOutput.printBanner(properties.getVersion());
    if (concurrency.stream().anyMatch(level -> level == null || level < 1)) {
      ConsoleOutput.error("Concurrency levels must be positive: " + concurrency);
      return EXIT_FAILED;
    }

    List<CorpusRecord> corpus;
    try {
      corpus = loadCorpus();
    } catch (IOException e) {
      ConsoleOutput.error("Cannot read " + inputFile + ": " + e.getMessage());
      return EXIT_FAILED;
    }
    if (corpus.isEmpty()) {
      ConsoleOutput.error("No usable records in " + inputFile);
      return EXIT_FAILED;
    }
    ConsoleOutput.info("Loaded " + corpus.size() + " test items from " + inputFile);

    int poolSize = concurrency.stream().mapToInt(Integer::intValue).max().orElse(1);
    ClassifyClient client = createClient(poolSize);
    try {
      if (!client.isHealthy()) {
        ConsoleOutput.error("Server at " + serverUrl + " is not healthy; aborting");
        return EXIT_FAILED;
      }
      ConsoleOutput.success("Server at " + serverUrl + " is healthy");

      LoadHarness harness =
          LoadHarness.builder()
              .client(client)
              .corpus(corpus)
              .numExamples(numExamples)
              .maxTextLength(maxTextLength)
              .seed(seed)
              .build();
      List<LoadTestMetrics> results =
          harness.runScaling(
              concurrency,
              Duration.ofSeconds(durationSeconds),
              Duration.ofSeconds(rampUpSeconds),
              Duration.ofSeconds(cooldownSeconds),
              rate);

      ConsoleOutput.levelTable(results);
      LoadHarness.peakThroughput(results)
          .ifPresent(
              peak ->
                  ConsoleOutput.success(
                      String.format(
                          "Peak throughput %.2f req/s at concurrency %d",
                          peak.getRequestsPerSecond(), peak.getConcurrencyLevel())));

      LoadTestReportWriter writer = new LoadTestReportWriter(objectMapper);
      Map<String, Object> config = testConfig(corpus.size());
      ConsoleOutput.info("Wrote " + writer.writeRun(outputDir, config, results));
      if (concurrency.size() > 1) {
        ConsoleOutput.info("Wrote " + writer.writeScalingReport(outputDir, config, results));
      }
      return EXIT_OK;
    } catch (IOException e) {
      ConsoleOutput.error("Failed to write results: " + e.getMessage());
      return EXIT_FAILED;
    } finally {
      closeQuietly(client);
    }
  }

  /** The client for the target server; pool sized so the client never caps concurrency. */
  ClassifyClient createClient(int poolSize) {
    return new HttpClassifyClient(
        serverUrl,
        apiKey,
        poolSize,
        Duration.ofSeconds(requestTimeoutSeconds).toMillis(),
        properties.getHttp().getConnectTimeoutMs());
  }

  private List<CorpusRecord> loadCorpus() throws IOException {
    List<CorpusRecord> all = corpusLoader.load(inputFile);
    if (numSamples == null || numSamples >= all.size()) {
      return all;
    }
    Random random = seed != null ? new Random(seed) : new Random();
    List<CorpusRecord> sampled =
        stratified
            ? CorpusSampler.stratified(all, numSamples, random)
            : CorpusSampler.random(all, numSamples, random);
    ConsoleOutput.info(
        String.format(
            "Performed %s sampling: %d of %d items",
            stratified ? "stratified" : "random", sampled.size(), all.size()));
    return sampled;
  }

  private Map<String, Object> testConfig(int corpusSize) {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("server_url", serverUrl);
    config.put("input_file", inputFile.toString());
    config.put("corpus_size", corpusSize);
    config.put("concurrency_levels", new ArrayList<>(concurrency));
    config.put("duration_seconds", durationSeconds);
    config.put("ramp_up_seconds", rampUpSeconds);
    config.put("cooldown_seconds", cooldownSeconds);
    config.put("num_examples", numExamples);
    config.put("max_text_length", maxTextLength);
    config.put("rate_limit", rate > 0 ? rate : null);
    config.put("seed", seed);
    return config;
  }

  private static void closeQuietly(ClassifyClient client) {
    if (client instanceof Closeable) {
      try {
        ((Closeable) client).close();
      } catch (IOException e) {
        log.warn("Failed to close client: {}", e.getMessage());
      }
    }
  }
}
