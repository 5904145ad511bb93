package com.ragmod.moderation.loadtest;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.dto.ClassifyRequest;
import com.ragmod.moderation.dto.ClassifyResponse;
import com.ragmod.moderation.service.corpus.CorpusLoader;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@DisplayName("LoadTestCommand Tests")
class LoadTestCommandTest {

  @TempDir Path tempDir;

  private Path corpus;
  private Path outputDir;

  /** Runs against an in-memory client instead of a server. */
  @Command(name = "loadtest")
  static class OfflineLoadTestCommand extends LoadTestCommand {
    private final boolean healthy;
    int requestedPoolSize;

    OfflineLoadTestCommand(boolean healthy) {
      super(new CorpusLoader(new ObjectMapper()), new ObjectMapper(), new ModerationProperties());
      this.healthy = healthy;
    }

    @Override
    ClassifyClient createClient(int poolSize) {
      requestedPoolSize = poolSize;
      return new ClassifyClient() {
        @Override
        public ClassifyOutcome classify(ClassifyRequest request) {
          return ClassifyOutcome.success(
              ClassifyResponse.builder().category("clean").outcome("ok").build());
        }

        @Override
        public boolean isHealthy() {
          return healthy;
        }
      };
    }
  }

  @BeforeEach
  void setUp() throws IOException {
    corpus = tempDir.resolve("corpus.jsonl");
    Files.write(
        corpus,
        List.of(
            "{\"text\": \"Have a nice day\", \"moderation_category\": \"clean\"}",
            "{\"text\": \"Buy cheap pills now\", \"moderation_category\": \"spam_or_scams\"}",
            "{\"text\": \"no label\"}"),
        StandardCharsets.UTF_8);
    outputDir = tempDir.resolve("results");
  }

  private int execute(OfflineLoadTestCommand command, String... extraArgs) {
    String[] base = {
      "--input-file", corpus.toString(),
      "--duration", "1",
      "--ramp-up", "0",
      "--cooldown", "0",
      "--output-dir", outputDir.toString(),
      "--seed", "7"
    };
    String[] args = Stream.concat(Stream.of(base), Stream.of(extraArgs)).toArray(String[]::new);
    return new CommandLine(command).execute(args);
  }

  private List<String> writtenFiles() throws IOException {
    try (Stream<Path> files = Files.list(outputDir)) {
      return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
    }
  }

  @Test
  @DisplayName("Should run a single level and write one result file")
  void shouldRunSingleLevel() throws IOException {
    OfflineLoadTestCommand command = new OfflineLoadTestCommand(true);

    int exitCode = execute(command, "--concurrency", "2");

    assertThat(exitCode).isEqualTo(LoadTestCommand.EXIT_OK);
    assertThat(command.requestedPoolSize).isEqualTo(2);
    List<String> files = writtenFiles();
    assertThat(files).hasSize(1);
    assertThat(files.get(0)).startsWith("load_test_");
  }

  @Test
  @DisplayName("Should sweep several levels and add a scaling report")
  void shouldRunScalingSweep() throws IOException {
    OfflineLoadTestCommand command = new OfflineLoadTestCommand(true);

    int exitCode = execute(command, "--concurrency", "1,3", "--num-samples", "2", "--stratified");

    assertThat(exitCode).isEqualTo(LoadTestCommand.EXIT_OK);
    assertThat(command.requestedPoolSize).isEqualTo(3);
    List<String> files = writtenFiles();
    assertThat(files).hasSize(2);
    assertThat(files.get(0)).startsWith("load_test_");
    assertThat(files.get(1)).startsWith("scaling_report_");
  }

  @Test
  @DisplayName("Should abort without results when the server is unhealthy")
  void shouldAbortWhenUnhealthy() {
    int exitCode = execute(new OfflineLoadTestCommand(false), "--concurrency", "1");

    assertThat(exitCode).isEqualTo(LoadTestCommand.EXIT_FAILED);
    assertThat(Files.exists(outputDir)).isFalse();
  }

  @Test
  @DisplayName("Should fail for a missing corpus or a non-positive level")
  void shouldFailOnBadInput() {
    assertThat(execute(new OfflineLoadTestCommand(true), "--concurrency", "0"))
        .isEqualTo(LoadTestCommand.EXIT_FAILED);

    OfflineLoadTestCommand command = new OfflineLoadTestCommand(true);
    int exitCode =
        new CommandLine(command)
            .execute("--input-file", tempDir.resolve("absent.jsonl").toString());
    assertThat(exitCode).isEqualTo(LoadTestCommand.EXIT_FAILED);
  }

  @Test
  @DisplayName("Should reject a missing required option as a usage error")
  void shouldRequireInputFile() {
    int exitCode = new CommandLine(new OfflineLoadTestCommand(true)).execute("--concurrency", "1");

    assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
  }
}
