package com.ragmod.moderation.service.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;

@DisplayName("CorpusLoader Tests")
class CorpusLoaderTest {

  @TempDir Path tempDir;

  private final CorpusLoader loader = new CorpusLoader(new ObjectMapper());

  private Path write(String... lines) throws IOException {
    Path file = tempDir.resolve("corpus.jsonl");
    Files.write(file, List.of(lines), StandardCharsets.UTF_8);
    return file;
  }

  @Test
  @DisplayName("Should read text, label and remaining fields as metadata")
  void shouldReadRecords() throws IOException {
    Path file =
        write(
            "{\"text\": \"I will hurt you\", \"moderation_category\": \"violence_or_threats\","
                + " \"source\": \"forum\", \"score\": 4}",
            "{\"text\": \"Have a nice day\"}");

    List<CorpusRecord> records = loader.load(file);

    assertThat(records).hasSize(2);
    CorpusRecord first = records.get(0);
    assertThat(first.getText()).isEqualTo("I will hurt you");
    assertThat(first.getCategory()).contains(ModerationCategory.VIOLENCE_OR_THREATS);
    assertThat(first.getMetadata()).containsEntry("source", "forum").containsEntry("score", 4);
    assertThat(first.getMetadata()).doesNotContainKeys("text", "moderation_category");
    assertThat(records.get(1).isLabeled()).isFalse();
    assertThat(records.get(1).getLabel()).isNull();
  }

  @Test
  @DisplayName("Should keep records whose label is outside the taxonomy but mark them unlabeled")
  void shouldKeepUnknownLabels() throws IOException {
    List<CorpusRecord> records =
        loader.load(write("{\"text\": \"hmm\", \"moderation_category\": \"misinformation\"}"));

    assertThat(records)
        .singleElement()
        .satisfies(
            r -> {
              assertThat(r.getLabel()).isEqualTo("misinformation");
              assertThat(r.isLabeled()).isFalse();
            });
  }

  @Test
  @DisplayName("Should skip blank, malformed and textless lines")
  void shouldSkipBadLines() throws IOException {
    Path file =
        write(
            "",
            "not json",
            "{\"moderation_category\": \"clean\"}",
            "{\"text\": \"   \"}",
            "[1, 2]",
            "{\"text\": \"ok\", \"moderation_category\": \"clean\"}");

    List<CorpusRecord> records = loader.load(file);

    assertThat(records).extracting(CorpusRecord::getText).containsExactly("ok");
  }

  @Test
  @DisplayName("Should fail for a missing file")
  void shouldFailForMissingFile() {
    assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.jsonl")))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("Corpus file not found");
  }
}
