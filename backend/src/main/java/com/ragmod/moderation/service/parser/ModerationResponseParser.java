package com.ragmod.moderation.service.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns the model's free text into a category, confidence and explanation. Total over all inputs:
 * any string, including null and empty, yields a category from the taxonomy and never throws.
 */
@Slf4j
@Service
public class ModerationResponseParser {

  // Tolerates markdown decoration such as "**Category:** [spam_or_scams]"
  private static final String DECORATION = "[\\s*\\[\"'`]*";

  private static final Pattern CATEGORY_PATTERN =
      Pattern.compile("category\\s*:" + DECORATION + "(\\w+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern CONFIDENCE_PATTERN =
      Pattern.compile(
          "confidence\\s*:" + DECORATION + "(HIGH|MEDIUM|LOW)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern EXPLANATION_PATTERN =
      Pattern.compile("explanation\\s*:\\**\\s*(.+?)\\s*(?:\\n|$)", Pattern.CASE_INSENSITIVE);

  private final double confidenceThreshold;
  private final CategoryTieBreak tieBreak;

  @Autowired
  public ModerationResponseParser(ModerationProperties properties) {
    this(properties.getParser().getConfidenceThreshold(), properties.getParser().getTieBreak());
  }

  public ModerationResponseParser(double confidenceThreshold, CategoryTieBreak tieBreak) {
    this.confidenceThreshold = confidenceThreshold;
    this.tieBreak = tieBreak == null ? CategoryTieBreak.FIRST_MATCH : tieBreak;
  }

  public ParsedModeration parse(String rawText) {
    String text = rawText == null ? "" : rawText;

    List<String> labels = new ArrayList<>();
    Matcher categoryMatcher = CATEGORY_PATTERN.matcher(text);
    while (categoryMatcher.find()) {
      labels.add(categoryMatcher.group(1));
    }

    ConfidenceLevel level = extractConfidence(text);
    String explanation = extractExplanation(text);
    ParsedModeration.ParsedModerationBuilder result =
        ParsedModeration.builder()
            .confidenceLevel(level)
            .confidence(level.getScore())
            .explanation(explanation);

    if (labels.isEmpty()) {
      log.info("Generation parse outcome=parse_failed, no category field found");
      ModerationCategory fallback = ModerationCategory.fallback();
      return result
          .category(fallback)
          .originalCategory(fallback)
          .outcome(ParseOutcome.PARSE_FAILED)
          .build();
    }

    Optional<ModerationCategory> chosen = choose(labels);
    if (chosen.isEmpty()) {
      log.info("Generation parse outcome=fallback, unknown category '{}'", labels.get(0));
      ModerationCategory fallback = ModerationCategory.fallback();
      return result
          .category(fallback)
          .originalCategory(fallback)
          .extractedLabel(labels.get(0))
          .outcome(ParseOutcome.FALLBACK)
          .build();
    }

    ModerationCategory category = chosen.get();
    result.extractedLabel(category.getLabel()).originalCategory(category);
    if (!category.isClean() && level.getScore() < confidenceThreshold) {
      log.info(
          "Generation parse outcome=downgraded, {} at confidence {} is below threshold {}",
          category,
          level,
          confidenceThreshold);
      return result.category(ModerationCategory.fallback()).outcome(ParseOutcome.DOWNGRADED).build();
    }
    return result.category(category).outcome(ParseOutcome.OK).build();
  }

  private Optional<ModerationCategory> choose(List<String> labels) {
    if (tieBreak == CategoryTieBreak.FIRST_MATCH) {
      return ModerationCategory.fromLabel(labels.get(0));
    }

    ModerationCategory firstValid = null;
    for (String label : labels) {
      Optional<ModerationCategory> category = ModerationCategory.fromLabel(label);
      if (category.isEmpty()) {
        continue;
      }
      if (!category.get().isClean()) {
        return category;
      }
      if (firstValid == null) {
        firstValid = category.get();
      }
    }
    return Optional.ofNullable(firstValid);
  }

  private static ConfidenceLevel extractConfidence(String text) {
    Matcher matcher = CONFIDENCE_PATTERN.matcher(text);
    if (matcher.find()) {
      return ConfidenceLevel.fromLabel(matcher.group(1)).orElse(ConfidenceLevel.LOW);
    }
    return ConfidenceLevel.LOW;
  }

  private static String extractExplanation(String text) {
    Matcher matcher = EXPLANATION_PATTERN.matcher(text);
    return matcher.find() ? matcher.group(1).trim() : "";
  }
}
