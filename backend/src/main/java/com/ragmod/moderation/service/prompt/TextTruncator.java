package com.ragmod.moderation.service.prompt;

/** Length limits that never split a surrogate pair. */
public final class TextTruncator {

  private TextTruncator() {}

  /**
   * Returns at most {@code maxCodePoints} leading code points of {@code text}. A non-positive
   * limit disables truncation.
   */
  public static String truncate(String text, int maxCodePoints) {
    if (text == null) {
      return "";
    }
    if (maxCodePoints <= 0 || text.length() <= maxCodePoints) {
      return text;
    }
    if (text.codePointCount(0, text.length()) <= maxCodePoints) {
      return text;
    }
    return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
  }
}
