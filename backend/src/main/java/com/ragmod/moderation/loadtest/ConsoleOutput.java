package com.ragmod.moderation.loadtest;

import java.util.List;

import picocli.CommandLine;

/** ANSI-colored terminal output for the load-test CLI. */
public final class ConsoleOutput {

  private ConsoleOutput() {}

  public static void printBanner(String version) {
    System.out.println(
        CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) RAG MODERATION LOAD TEST " + version + "|@"));
    System.out.println("──────────────────────────────────");
  }

  public static void info(String message) {
    System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [LOADTEST]|@ " + message));
  }

  public static void success(String message) {
    System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
  }

  public static void error(String message) {
    System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
  }

  /** One row per level; the throughput peak is highlighted. */
  public static void levelTable(List<LoadTestMetrics> results) {
    LoadTestMetrics peak = LoadHarness.peakThroughput(results).orElse(null);
    System.out.println(
        String.format(
            "%-12s %10s %10s %10s %10s %10s %10s",
            "concurrency", "req/s", "p50 ms", "p95 ms", "p99 ms", "errors", "accuracy"));
    for (LoadTestMetrics m : results) {
      String row =
          String.format(
              "%-12d %10.2f %10.1f %10.1f %10.1f %9.1f%% %10s",
              m.getConcurrencyLevel(),
              m.getRequestsPerSecond(),
              m.getP50LatencyMs(),
              m.getP95LatencyMs(),
              m.getP99LatencyMs(),
              m.getErrorRate() * 100,
              m.getAccuracy() != null ? String.format("%.1f%%", m.getAccuracy()) : "-");
      System.out.println(
          m == peak ? CommandLine.Help.Ansi.AUTO.string("@|bold,fg(green) " + row + "|@") : row);
    }
  }
}
