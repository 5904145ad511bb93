package com.ragmod.moderation.service.parser;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a generation was turned into a label. */
public enum ParseOutcome {
  /** A valid category was found and kept. */
  OK("ok"),
  /** A {@code Category:} field was found but named no known category. */
  FALLBACK("fallback"),
  /** No {@code Category:} field at all. */
  PARSE_FAILED("parse_failed"),
  /** A valid non-clean category was replaced by clean for falling under the confidence threshold. */
  DOWNGRADED("downgraded");

  private final String tag;

  ParseOutcome(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String getTag() {
    return tag;
  }

  /** True when the label is the fallback rather than something the model actually said. */
  public boolean isDegraded() {
    return this == FALLBACK || this == PARSE_FAILED;
  }
}
