package com.ragmod.moderation.service.classification;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.ragmod.moderation.service.parser.ConfidenceLevel;
import com.ragmod.moderation.service.parser.ParseOutcome;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;
import com.ragmod.moderation.service.vector.RetrievedExample;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class ClassificationResult {

  String query;
  ModerationCategory category;
  double confidence;
  ConfidenceLevel confidenceLevel;
  String explanation;
  ParseOutcome outcome;
  String rawResponse;
  String prompt;

  /** Nearest first. */
  @Singular List<RetrievedExample> retrievedExamples;

  /** One entry per stage, in execution order. */
  @Singular List<StageTiming> stageTimings;

  Instant timestamp;

  /** Sum of the stage latencies. */
  public double getTotalLatencyMs() {
    return stageTimings.stream().mapToDouble(StageTiming::getLatencyMs).sum();
  }

  public Optional<StageTiming> timingOf(ClassificationStage stage) {
    return stageTimings.stream().filter(t -> t.getStage() == stage).findFirst();
  }

  public boolean isParseFailed() {
    return outcome == ParseOutcome.PARSE_FAILED;
  }
}
