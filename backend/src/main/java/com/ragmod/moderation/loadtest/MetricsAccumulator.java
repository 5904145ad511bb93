package com.ragmod.moderation.loadtest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.ragmod.moderation.dto.ClassifyResponse;
import com.ragmod.moderation.service.parser.ParseOutcome;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;

/**
 * Collects per-request results from many workers. All mutators are synchronized; the lock is held
 * only for a few field updates per request.
 */
public class MetricsAccumulator {

  private final List<Double> latencies = new ArrayList<>();
  private final Map<String, long[]> perCategory = new TreeMap<>();

  private long requests;
  private long failures;
  private long fallbacks;
  private long parseFailures;
  private long timedResponses;
  private double embeddingMsSum;
  private double retrievalMsSum;
  private double generationMsSum;
  private long predictions;
  private long correctPredictions;

  /**
   * Records one request.
   *
   * @param latencyMs round-trip latency as seen by the client
   * @param expected ground-truth category, or null when the item is unlabeled
   */
  public synchronized void record(
      ClassifyOutcome outcome, double latencyMs, ModerationCategory expected) {
    requests++;
    if (!outcome.isSuccess() || outcome.getResponse() == null) {
      failures++;
      return;
    }
    ClassifyResponse response = outcome.getResponse();
    latencies.add(latencyMs);

    if (response.getTiming() != null) {
      timedResponses++;
      embeddingMsSum += response.getTiming().getEmbeddingMs();
      retrievalMsSum += response.getTiming().getRetrievalMs();
      generationMsSum += response.getTiming().getGenerationMs();
    }
    if (ParseOutcome.FALLBACK.getTag().equals(response.getOutcome())) {
      fallbacks++;
    } else if (ParseOutcome.PARSE_FAILED.getTag().equals(response.getOutcome())) {
      parseFailures++;
    }

    if (expected != null) {
      long[] counts = perCategory.computeIfAbsent(expected.getLabel(), k -> new long[2]);
      predictions++;
      counts[1]++;
      if (expected.getLabel().equals(response.getCategory())) {
        correctPredictions++;
        counts[0]++;
      }
    }
  }

  public synchronized long getRequestCount() {
    return requests;
  }

  /** Finalizes the run into metrics; throughput is completed requests over elapsed wall time. */
  public synchronized LoadTestMetrics toMetrics(
      int concurrency, Duration elapsed, Duration rampUp) {
    double seconds = elapsed.toNanos() / 1_000_000_000.0;
    List<Double> sorted = new ArrayList<>(latencies);
    Collections.sort(sorted);

    LoadTestMetrics.LoadTestMetricsBuilder builder =
        LoadTestMetrics.builder()
            .concurrencyLevel(concurrency)
            .requestsPerSecond(seconds > 0 ? requests / seconds : 0)
            .totalRequests(requests)
            .successfulRequests(requests - failures)
            .failedRequests(failures)
            .averageLatencyMs(
                sorted.stream().mapToDouble(Double::doubleValue).average().orElse(0))
            .p50LatencyMs(percentile(sorted, 50))
            .p95LatencyMs(percentile(sorted, 95))
            .p99LatencyMs(percentile(sorted, 99))
            .errorRate(requests > 0 ? (double) failures / requests : 0)
            .avgEmbeddingMs(timedResponses > 0 ? embeddingMsSum / timedResponses : 0)
            .avgRetrievalMs(timedResponses > 0 ? retrievalMsSum / timedResponses : 0)
            .avgGenerationMs(timedResponses > 0 ? generationMsSum / timedResponses : 0)
            .fallbackCount(fallbacks)
            .parseFailedCount(parseFailures)
            .durationSeconds(seconds)
            .rampUpSeconds(rampUp.toMillis() / 1000.0);

    if (predictions > 0) {
      builder.accuracy(correctPredictions * 100.0 / predictions);
      Map<String, LoadTestMetrics.CategoryAccuracy> categories = new TreeMap<>();
      perCategory.forEach(
          (label, counts) ->
              categories.put(
                  label,
                  LoadTestMetrics.CategoryAccuracy.builder()
                      .correct(counts[0])
                      .total(counts[1])
                      .accuracy(counts[0] * 100.0 / counts[1])
                      .build()));
      builder.perCategoryAccuracy(categories);
    }
    return builder.build();
  }

  /** Nearest-rank percentile of an ascending list: {@code sorted[min(n-1, floor(n*p/100))]}. */
  static double percentile(List<Double> sorted, double p) {
    if (sorted.isEmpty()) {
      return 0;
    }
    int n = sorted.size();
    int rank = (int) Math.floor(n * p / 100.0);
    return sorted.get(Math.min(n - 1, rank));
  }
}
