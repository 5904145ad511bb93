package com.ragmod.moderation.loadtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.ragmod.moderation.dto.ClassifyResponse;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;

@DisplayName("MetricsAccumulator Tests")
class MetricsAccumulatorTest {

  private static ClassifyOutcome answered(String category, String outcome) {
    return ClassifyOutcome.success(
        ClassifyResponse.builder()
            .category(category)
            .outcome(outcome)
            .timing(
                ClassifyResponse.Timing.builder()
                    .embeddingMs(10)
                    .retrievalMs(2)
                    .generationMs(100)
                    .build())
            .build());
  }

  @Nested
  @DisplayName("Percentile Tests")
  class PercentileTests {

    private final List<Double> tenValues =
        List.of(10.0, 20.0, 30.0, 40.0, 50.0, 60.0, 70.0, 80.0, 90.0, 100.0);

    @Test
    @DisplayName("Should use the nearest rank at floor(n * p / 100)")
    void shouldUseNearestRank() {
      assertThat(MetricsAccumulator.percentile(tenValues, 50)).isEqualTo(60.0);
      assertThat(MetricsAccumulator.percentile(tenValues, 95)).isEqualTo(100.0);
      assertThat(MetricsAccumulator.percentile(tenValues, 99)).isEqualTo(100.0);
      assertThat(MetricsAccumulator.percentile(tenValues, 0)).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should handle empty and single-value samples")
    void shouldHandleSmallSamples() {
      assertThat(MetricsAccumulator.percentile(List.of(), 95)).isZero();
      assertThat(MetricsAccumulator.percentile(List.of(42.0), 50)).isEqualTo(42.0);
      assertThat(MetricsAccumulator.percentile(List.of(42.0), 99)).isEqualTo(42.0);
    }
  }

  @Test
  @DisplayName("Should count failures in the error rate but not in latencies")
  void shouldSeparateFailures() {
    MetricsAccumulator accumulator = new MetricsAccumulator();
    accumulator.record(answered("clean", "ok"), 100, null);
    accumulator.record(answered("clean", "ok"), 300, null);
    accumulator.record(ClassifyOutcome.failure("504 timeout", 504), 60_000, null);
    accumulator.record(ClassifyOutcome.failure("connection refused", null), 1, null);

    LoadTestMetrics metrics =
        accumulator.toMetrics(2, Duration.ofSeconds(2), Duration.ofMillis(500));

    assertThat(metrics.getTotalRequests()).isEqualTo(4);
    assertThat(metrics.getSuccessfulRequests()).isEqualTo(2);
    assertThat(metrics.getFailedRequests()).isEqualTo(2);
    assertThat(metrics.getErrorRate()).isEqualTo(0.5);
    assertThat(metrics.getRequestsPerSecond()).isCloseTo(2.0, within(1e-9));
    assertThat(metrics.getAverageLatencyMs()).isEqualTo(200.0);
    assertThat(metrics.getP99LatencyMs()).isEqualTo(300.0);
    assertThat(metrics.getAvgGenerationMs()).isEqualTo(100.0);
    assertThat(metrics.getRampUpSeconds()).isEqualTo(0.5);
    assertThat(metrics.getAccuracy()).isNull();
    assertThat(metrics.getPerCategoryAccuracy()).isNull();
  }

  @Test
  @DisplayName("Should compute overall and per-category accuracy over labeled items")
  void shouldComputeAccuracy() {
    MetricsAccumulator accumulator = new MetricsAccumulator();
    accumulator.record(
        answered("violence_or_threats", "ok"), 10, ModerationCategory.VIOLENCE_OR_THREATS);
    accumulator.record(answered("clean", "ok"), 10, ModerationCategory.VIOLENCE_OR_THREATS);
    accumulator.record(answered("spam_or_scams", "ok"), 10, ModerationCategory.SPAM_OR_SCAMS);
    accumulator.record(answered("clean", "fallback"), 10, ModerationCategory.CLEAN);
    accumulator.record(answered("clean", "parse_failed"), 10, null);

    LoadTestMetrics metrics = accumulator.toMetrics(1, Duration.ofSeconds(1), Duration.ZERO);

    assertThat(metrics.getAccuracy()).isEqualTo(75.0);
    assertThat(metrics.getFallbackCount()).isEqualTo(1);
    assertThat(metrics.getParseFailedCount()).isEqualTo(1);
    assertThat(metrics.getPerCategoryAccuracy())
        .containsOnlyKeys("clean", "spam_or_scams", "violence_or_threats");
    LoadTestMetrics.CategoryAccuracy threats =
        metrics.getPerCategoryAccuracy().get("violence_or_threats");
    assertThat(threats.getCorrect()).isEqualTo(1);
    assertThat(threats.getTotal()).isEqualTo(2);
    assertThat(threats.getAccuracy()).isEqualTo(50.0);
  }

  @Test
  @DisplayName("Should report zeros for a run without requests")
  void shouldHandleEmptyRun() {
    LoadTestMetrics metrics =
        new MetricsAccumulator().toMetrics(4, Duration.ofSeconds(1), Duration.ZERO);

    assertThat(metrics.getTotalRequests()).isZero();
    assertThat(metrics.getErrorRate()).isZero();
    assertThat(metrics.getP50LatencyMs()).isZero();
    assertThat(metrics.getConcurrencyLevel()).isEqualTo(4);
  }
}
