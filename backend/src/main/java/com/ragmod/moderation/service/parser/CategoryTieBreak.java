package com.ragmod.moderation.service.parser;

/** Which label wins when a generation mentions more than one category. */
public enum CategoryTieBreak {
  /** The first {@code Category:} field decides, valid or not. */
  FIRST_MATCH,
  /** The first valid non-clean category wins; clean only when nothing else is named. */
  FIRST_UNSAFE
}
