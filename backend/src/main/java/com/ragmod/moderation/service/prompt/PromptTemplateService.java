package com.ragmod.moderation.service.prompt;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import lombok.extern.slf4j.Slf4j;

/** Reads prompt templates from {@code prompts/<name>.txt} on the classpath. */
@Slf4j
@Service
public class PromptTemplateService {

  static final String TEMPLATE_DIRECTORY = "prompts/";

  /**
   * Returns the template with line endings normalized to {@code \n} and trailing line breaks
   * removed, so the rendered prompt ends with the query.
   */
  public String loadPromptTemplate(String name) throws IOException {
    if (name == null || name.isBlank() || name.contains("/") || name.contains("..")) {
      throw new IllegalArgumentException("Invalid prompt template name: " + name);
    }

    ClassPathResource resource = new ClassPathResource(TEMPLATE_DIRECTORY + name + ".txt");
    if (!resource.exists()) {
      throw new IOException("Prompt template not found on classpath: " + resource.getPath());
    }

    String template;
    try (InputStream in = resource.getInputStream()) {
      template = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
    }
    template = template.replace("\r\n", "\n");
    int end = template.length();
    while (end > 0 && template.charAt(end - 1) == '\n') {
      end--;
    }
    log.debug("Loaded prompt template {} ({} chars)", name, end);
    return template.substring(0, end);
  }
}
