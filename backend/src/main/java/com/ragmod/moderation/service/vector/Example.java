package com.ragmod.moderation.service.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.ragmod.moderation.service.taxonomy.ModerationCategory;

import lombok.Builder;
import lombok.Value;

/** A labeled text used as retrieval context. Immutable once indexed. */
@Value
public class Example {

  String text;
  ModerationCategory category;
  Map<String, Object> metadata;

  @Builder
  public Example(String text, ModerationCategory category, Map<String, Object> metadata) {
    this.text = Objects.requireNonNull(text, "text");
    this.category = Objects.requireNonNull(category, "category");
    this.metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static Example of(String text, ModerationCategory category) {
    return new Example(text, category, null);
  }
}
