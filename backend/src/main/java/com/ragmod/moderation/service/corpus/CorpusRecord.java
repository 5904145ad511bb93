package com.ragmod.moderation.service.corpus;

import java.util.Map;
import java.util.Optional;

import com.ragmod.moderation.service.taxonomy.ModerationCategory;

import lombok.Builder;
import lombok.Value;

/** One line of a JSONL corpus. The label is optional and may name an unknown category. */
@Value
@Builder
public class CorpusRecord {

  String text;

  /** The raw {@code moderation_category} value, or null when the line has none. */
  String label;

  Map<String, Object> metadata;

  public Optional<ModerationCategory> getCategory() {
    return ModerationCategory.fromLabel(label);
  }

  public boolean isLabeled() {
    return getCategory().isPresent();
  }
}
