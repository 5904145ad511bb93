package com.ragmod.moderation;

import java.util.Arrays;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class ModerationApplication {

  static final String LOAD_TEST_COMMAND = "loadtest";

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(ModerationApplication.class);
    if (!isLoadTest(args)) {
      app.run(args);
      return;
    }

    // The harness is a client of a running server, so no embedded web server here
    app.setWebApplicationType(WebApplicationType.NONE);
    app.setAdditionalProfiles("cli");
    ConfigurableApplicationContext context = app.run(args);
    System.exit(SpringApplication.exit(context));
  }

  public static boolean isLoadTest(String[] args) {
    return args != null && Arrays.asList(args).contains(LOAD_TEST_COMMAND);
  }
}
