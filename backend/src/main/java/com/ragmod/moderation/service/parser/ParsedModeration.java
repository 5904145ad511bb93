package com.ragmod.moderation.service.parser;

import com.ragmod.moderation.service.taxonomy.ModerationCategory;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParsedModeration {

  /** Always a member of the taxonomy. */
  ModerationCategory category;

  ConfidenceLevel confidenceLevel;
  double confidence;
  String explanation;
  ParseOutcome outcome;

  /** The token found after {@code Category:}, or null when there was none. */
  String extractedLabel;

  /** The category before a confidence downgrade; equal to {@link #category} otherwise. */
  ModerationCategory originalCategory;

  public boolean isParseFailed() {
    return outcome == ParseOutcome.PARSE_FAILED;
  }
}
