package com.ragmod.moderation.loadtest;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Aggregated results of one load-test run at a single concurrency level. Latencies in ms. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoadTestMetrics {

  @JsonProperty("concurrency_level")
  private int concurrencyLevel;

  @JsonProperty("requests_per_second")
  private double requestsPerSecond;

  @JsonProperty("total_requests")
  private long totalRequests;

  @JsonProperty("successful_requests")
  private long successfulRequests;

  @JsonProperty("failed_requests")
  private long failedRequests;

  @JsonProperty("average_latency_ms")
  private double averageLatencyMs;

  @JsonProperty("p50_latency_ms")
  private double p50LatencyMs;

  @JsonProperty("p95_latency_ms")
  private double p95LatencyMs;

  @JsonProperty("p99_latency_ms")
  private double p99LatencyMs;

  /** Failed over total requests, 0 when nothing was sent. */
  @JsonProperty("error_rate")
  private double errorRate;

  @JsonProperty("avg_embedding_ms")
  private double avgEmbeddingMs;

  @JsonProperty("avg_retrieval_ms")
  private double avgRetrievalMs;

  @JsonProperty("avg_generation_ms")
  private double avgGenerationMs;

  @JsonProperty("fallback_count")
  private long fallbackCount;

  @JsonProperty("parse_failed_count")
  private long parseFailedCount;

  /** Percentage of correct predictions, null when no labeled item was classified. */
  @JsonProperty("accuracy")
  private Double accuracy;

  @JsonProperty("per_category_accuracy")
  private Map<String, CategoryAccuracy> perCategoryAccuracy;

  @JsonProperty("duration_seconds")
  private double durationSeconds;

  @JsonProperty("ramp_up_seconds")
  private double rampUpSeconds;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CategoryAccuracy {
    @JsonProperty("correct")
    private long correct;

    @JsonProperty("total")
    private long total;

    @JsonProperty("accuracy")
    private double accuracy;
  }
}
