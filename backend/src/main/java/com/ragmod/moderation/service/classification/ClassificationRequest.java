package com.ragmod.moderation.service.classification;

import lombok.Builder;
import lombok.Value;

/** One text to classify, with the per-call knobs. */
@Value
@Builder
public class ClassificationRequest {
  String text;
  int numExamples;
  int maxTextLength;
  int maxGeneratedTokens;
}
