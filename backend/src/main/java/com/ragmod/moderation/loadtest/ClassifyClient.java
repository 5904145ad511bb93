package com.ragmod.moderation.loadtest;

import com.ragmod.moderation.dto.ClassifyRequest;

/**
 * Something the load harness can send classification requests to. Implementations report
 * failures through {@link ClassifyOutcome} instead of throwing.
 */
public interface ClassifyClient {

  ClassifyOutcome classify(ClassifyRequest request);

  /** Whether the target is ready to take traffic. */
  default boolean isHealthy() {
    return true;
  }
}
