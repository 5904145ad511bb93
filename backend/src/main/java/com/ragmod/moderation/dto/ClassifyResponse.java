package com.ragmod.moderation.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragmod.moderation.service.classification.ClassificationResult;
import com.ragmod.moderation.service.classification.ClassificationStage;
import com.ragmod.moderation.service.classification.StageTiming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassifyResponse {

  @JsonProperty("query")
  private String query;

  @JsonProperty("category")
  private String category;

  @JsonProperty("confidence")
  private double confidence;

  @JsonProperty("confidence_level")
  private String confidenceLevel;

  @JsonProperty("explanation")
  private String explanation;

  @JsonProperty("outcome")
  private String outcome;

  @JsonProperty("raw_response")
  private String rawResponse;

  @JsonProperty("similar_examples")
  private List<SimilarExample> similarExamples;

  @JsonProperty("prompt")
  private String prompt;

  @JsonProperty("timing")
  private Timing timing;

  @JsonProperty("attempts")
  private Attempts attempts;

  @JsonProperty("timestamp")
  private Instant timestamp;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class SimilarExample {
    @JsonProperty("text")
    private String text;

    @JsonProperty("category")
    private String category;

    @JsonProperty("distance")
    private double distance;
  }

  /** Per-stage latencies in milliseconds. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Timing {
    @JsonProperty("embedding_ms")
    private double embeddingMs;

    @JsonProperty("retrieval_ms")
    private double retrievalMs;

    @JsonProperty("prompt_ms")
    private double promptMs;

    @JsonProperty("generation_ms")
    private double generationMs;

    @JsonProperty("parse_ms")
    private double parseMs;

    @JsonProperty("total_ms")
    private double totalMs;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Attempts {
    @JsonProperty("embedding")
    private int embedding;

    @JsonProperty("retrieval")
    private int retrieval;

    @JsonProperty("generation")
    private int generation;
  }

  public static ClassifyResponse from(ClassificationResult result, boolean includePrompt) {
    return ClassifyResponse.builder()
        .query(result.getQuery())
        .category(result.getCategory().getLabel())
        .confidence(result.getConfidence())
        .confidenceLevel(result.getConfidenceLevel().name())
        .explanation(result.getExplanation())
        .outcome(result.getOutcome().getTag())
        .rawResponse(result.getRawResponse())
        .similarExamples(
            result.getRetrievedExamples().stream()
                .map(
                    e ->
                        new SimilarExample(e.getText(), e.getCategory().getLabel(), e.getDistance()))
                .toList())
        .prompt(includePrompt ? result.getPrompt() : null)
        .timing(
            Timing.builder()
                .embeddingMs(latency(result, ClassificationStage.EMBED_QUERY))
                .retrievalMs(latency(result, ClassificationStage.RETRIEVE))
                .promptMs(latency(result, ClassificationStage.ASSEMBLE_PROMPT))
                .generationMs(latency(result, ClassificationStage.GENERATE))
                .parseMs(latency(result, ClassificationStage.PARSE_AND_VALIDATE))
                .totalMs(result.getTotalLatencyMs())
                .build())
        .attempts(
            Attempts.builder()
                .embedding(attempts(result, ClassificationStage.EMBED_QUERY))
                .retrieval(attempts(result, ClassificationStage.RETRIEVE))
                .generation(attempts(result, ClassificationStage.GENERATE))
                .build())
        .timestamp(result.getTimestamp())
        .build();
  }

  private static double latency(ClassificationResult result, ClassificationStage stage) {
    return result.timingOf(stage).map(StageTiming::getLatencyMs).orElse(0.0);
  }

  private static int attempts(ClassificationResult result, ClassificationStage stage) {
    return result.timingOf(stage).map(StageTiming::getAttempts).orElse(0);
  }
}
