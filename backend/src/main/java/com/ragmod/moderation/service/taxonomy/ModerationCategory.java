package com.ragmod.moderation.service.taxonomy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of moderation labels. {@link #CLEAN} is the benign label and the fallback for
 * anything that cannot be mapped onto the set.
 */
public enum ModerationCategory {
  HATE_OR_DISCRIMINATION(
      "hate_or_discrimination",
      "Content targeting protected characteristics with negative intent/prejudice"),
  VIOLENCE_OR_THREATS(
      "violence_or_threats", "Content that threatens, depicts, or promotes violence"),
  OFFENSIVE_LANGUAGE(
      "offensive_language",
      "Hostile or inappropriate content WITHOUT targeting protected characteristics"),
  NSFW_CONTENT("nsfw_content", "Explicit sexual content or material intended to arouse"),
  SPAM_OR_SCAMS("spam_or_scams", "Deceptive or unsolicited content designed to mislead"),
  CLEAN("clean", "Content that is allowed and doesn't fall into above categories");

  private static final Map<String, ModerationCategory> BY_LABEL =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(ModerationCategory::getLabel, Function.identity()));

  private final String label;
  private final String description;

  ModerationCategory(String label, String description) {
    this.label = label;
    this.description = description;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public String getDescription() {
    return description;
  }

  public boolean isClean() {
    return this == CLEAN;
  }

  /**
   * Maps a free-text candidate onto the taxonomy. Matching ignores case and surrounding
   * whitespace; anything else must be an exact label.
   */
  public static Optional<ModerationCategory> fromLabel(String candidate) {
    if (candidate == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_LABEL.get(candidate.trim().toLowerCase(Locale.ROOT)));
  }

  public static ModerationCategory fallback() {
    return CLEAN;
  }

  @JsonCreator
  public static ModerationCategory fromJson(String label) {
    return fromLabel(label)
        .orElseThrow(() -> new IllegalArgumentException("Unknown moderation category: " + label));
  }

  @Override
  public String toString() {
    return label;
  }
}
