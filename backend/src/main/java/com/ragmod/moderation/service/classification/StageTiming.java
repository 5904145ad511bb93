package com.ragmod.moderation.service.classification;

import lombok.Value;

@Value
public class StageTiming {
  ClassificationStage stage;
  double latencyMs;

  /** Upstream calls made during the stage; 0 for stages that stay in process. */
  int attempts;
}
