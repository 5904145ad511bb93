package com.ragmod.moderation.loadtest;

import org.springframework.stereotype.Component;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Top-level CLI command; the server itself starts without one. */
@Command(
    name = "rag-moderation",
    mixinStandardHelpOptions = true,
    description = "RAG moderation classifier tools",
    subcommands = {LoadTestCommand.class, CommandLine.HelpCommand.class})
@Component
public class ModerationCommand implements Runnable {

  @Override
  public void run() {
    new CommandLine(this).usage(System.out);
  }
}
