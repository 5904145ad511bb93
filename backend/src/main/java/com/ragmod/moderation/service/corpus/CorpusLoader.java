package com.ragmod.moderation.service.corpus;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads JSONL corpora: one JSON object per line with a required {@code text} field and an optional
 * {@code moderation_category}. Every other field is kept as metadata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusLoader {

  static final String TEXT_FIELD = "text";
  static final String LABEL_FIELD = "moderation_category";

  private final ObjectMapper objectMapper;

  public List<CorpusRecord> load(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new IOException("Corpus file not found: " + path);
    }

    List<CorpusRecord> records = new ArrayList<>();
    int skipped = 0;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        CorpusRecord record = parseLine(line, lineNumber);
        if (record == null) {
          skipped++;
        } else {
          records.add(record);
        }
      }
    }

    long labeled = records.stream().filter(CorpusRecord::isLabeled).count();
    log.info(
        "Loaded {} corpus records from {} ({} labeled, {} lines skipped)",
        records.size(),
        path,
        labeled,
        skipped);
    return records;
  }

  private CorpusRecord parseLine(String line, int lineNumber) {
    JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      log.warn("Skipping corpus line {}: not valid JSON ({})", lineNumber, e.getOriginalMessage());
      return null;
    }

    JsonNode text = node.get(TEXT_FIELD);
    if (!node.isObject() || text == null || !text.isTextual() || text.asText().isBlank()) {
      log.warn("Skipping corpus line {}: no text", lineNumber);
      return null;
    }

    JsonNode label = node.get(LABEL_FIELD);
    Map<String, Object> metadata = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!TEXT_FIELD.equals(field.getKey()) && !LABEL_FIELD.equals(field.getKey())) {
        metadata.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
      }
    }

    return CorpusRecord.builder()
        .text(text.asText())
        .label(label == null || label.isNull() ? null : label.asText())
        .metadata(metadata)
        .build();
  }
}
