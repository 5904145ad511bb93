package com.ragmod.moderation.service.classification;

import java.util.List;

import com.ragmod.moderation.exception.UpstreamException;

import lombok.Getter;

/** A classification that stopped at {@link #getStage()}. */
@Getter
public class ClassificationException extends RuntimeException {

  private final ClassificationStage stage;

  /** Timings of the stages that completed before the failure, plus the failed one. */
  private final List<StageTiming> stageTimings;

  public ClassificationException(
      ClassificationStage stage, RuntimeException cause, List<StageTiming> stageTimings) {
    super(String.format("Classification failed at %s: %s", stage.getTag(), cause.getMessage()), cause);
    this.stage = stage;
    this.stageTimings = List.copyOf(stageTimings);
  }

  /** The upstream error kind, or null when the failure did not come from an upstream call. */
  public UpstreamException.Kind getUpstreamKind() {
    return getCause() instanceof UpstreamException
        ? ((UpstreamException) getCause()).getKind()
        : null;
  }

  /** Upstream calls made by the failed stage, or 0 when not an upstream failure. */
  public int getAttempts() {
    return getCause() instanceof UpstreamException
        ? ((UpstreamException) getCause()).getAttempts()
        : 0;
  }
}
