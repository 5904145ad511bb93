package com.ragmod.moderation.service.prompt;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;
import com.ragmod.moderation.service.vector.RetrievedExample;

import lombok.extern.slf4j.Slf4j;

/**
 * Renders the few-shot classification prompt. Templates use {@code {{QUERY}}} for the text under
 * classification and a {@code {{#EXAMPLES}}...{{/EXAMPLES}}} block that is repeated once per
 * retrieved example, with {@code {{TEXT}}}, {@code {{CATEGORY}}} and {@code {{POSITION}}} inside.
 */
@Slf4j
@Service
public class PromptAssembler {

  static final String EXAMPLES_OPEN = "{{#EXAMPLES}}";
  static final String EXAMPLES_CLOSE = "{{/EXAMPLES}}";

  private final String systemPrompt;
  private final String examplesTemplate;

  @Autowired
  public PromptAssembler(PromptTemplateService templates, ModerationProperties properties)
      throws IOException {
    this(
        templates.loadPromptTemplate(properties.getPrompt().getSystemTemplate()),
        templates.loadPromptTemplate(properties.getPrompt().getExamplesTemplate()));
  }

  PromptAssembler(String systemTemplate, String examplesTemplate) {
    this.systemPrompt = systemTemplate.replace("{{CATEGORIES}}", describeCategories());
    this.examplesTemplate = examplesTemplate;
    log.info(
        "Prompt templates loaded: system={} chars, examples={} chars",
        systemPrompt.length(),
        examplesTemplate.length());
  }

  /** The instruction prompt listing every category of the taxonomy. */
  public String getSystemPrompt() {
    return systemPrompt;
  }

  public String assemble(String query, List<RetrievedExample> examples, int maxTextLength) {
    return assemble(query, examples, examplesTemplate, maxTextLength);
  }

  /**
   * Renders {@code template} with the examples nearest first. The query and every example text are
   * cut to {@code maxTextLength} code points before substitution. Examples with equal distance
   * keep their given order.
   */
  public static String assemble(
      String query, List<RetrievedExample> examples, String template, int maxTextLength) {
    List<RetrievedExample> ordered = new ArrayList<>(examples);
    ordered.sort(Comparator.comparingDouble(RetrievedExample::getDistance));

    String truncatedQuery = TextTruncator.truncate(query, maxTextLength);
    int open = template.indexOf(EXAMPLES_OPEN);
    int close = template.indexOf(EXAMPLES_CLOSE);
    if (open < 0 || close < open) {
      return template.replace("{{QUERY}}", truncatedQuery);
    }

    String head = template.substring(0, open);
    String block = template.substring(open + EXAMPLES_OPEN.length(), close);
    String tail = template.substring(close + EXAMPLES_CLOSE.length());

    StringBuilder prompt = new StringBuilder(head.replace("{{QUERY}}", truncatedQuery));
    int position = 1;
    for (RetrievedExample example : ordered) {
      // Text goes in last so that placeholders inside user text stay literal
      prompt.append(
          block
              .replace("{{CATEGORY}}", example.getCategory().getLabel())
              .replace("{{POSITION}}", Integer.toString(position++))
              .replace("{{TEXT}}", TextTruncator.truncate(example.getText(), maxTextLength)));
    }
    prompt.append(tail.replace("{{QUERY}}", truncatedQuery));
    return prompt.toString();
  }

  private static String describeCategories() {
    ModerationCategory[] categories = ModerationCategory.values();
    return Arrays.stream(categories)
        .map(c -> (c.ordinal() + 1) + ". " + c.getLabel() + ": " + c.getDescription())
        .collect(Collectors.joining("\n"));
  }
}
