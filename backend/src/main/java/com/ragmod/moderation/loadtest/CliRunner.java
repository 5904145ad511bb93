package com.ragmod.moderation.loadtest;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import com.ragmod.moderation.ModerationApplication;

import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle. Without a CLI subcommand in the arguments the
 * application is serving HTTP and picocli is not involved.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

  private final ModerationCommand moderationCommand;
  private final IFactory factory;
  private int exitCode;

  public CliRunner(ModerationCommand moderationCommand, IFactory factory) {
    this.moderationCommand = moderationCommand;
    this.factory = factory;
  }

  @Override
  public void run(String... args) {
    if (!ModerationApplication.isLoadTest(args)) {
      return;
    }
    exitCode = new CommandLine(moderationCommand, factory).execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
