package com.ragmod.moderation.service.parser;

import java.util.Locale;
import java.util.Optional;

/** The confidence vocabulary the model is asked to use, with fixed numeric anchors. */
public enum ConfidenceLevel {
  HIGH(0.9),
  MEDIUM(0.6),
  LOW(0.3);

  private final double score;

  ConfidenceLevel(double score) {
    this.score = score;
  }

  public double getScore() {
    return score;
  }

  public static Optional<ConfidenceLevel> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
