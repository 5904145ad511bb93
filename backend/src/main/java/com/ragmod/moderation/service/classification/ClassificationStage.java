package com.ragmod.moderation.service.classification;

/** The sequential stages of one classification, in execution order. */
public enum ClassificationStage {
  EMBED_QUERY("embedding"),
  RETRIEVE("retrieval"),
  ASSEMBLE_PROMPT("prompt"),
  GENERATE("generation"),
  PARSE_AND_VALIDATE("parse");

  private final String tag;

  ClassificationStage(String tag) {
    this.tag = tag;
  }

  /** Short name used in logs, error bodies and metrics. */
  public String getTag() {
    return tag;
  }
}
