package com.ragmod.moderation.service.gateway;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.exception.UpstreamException;
import com.ragmod.moderation.exception.UpstreamUnreachableException;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded exponential backoff with jitter for upstream calls. Only failures accepted by the
 * retryable predicate are retried; the delay doubles after each attempt and is capped at {@code
 * maxDelayMs}.
 */
@Slf4j
@Getter
public class RetryPolicy {

  /** Blocks the calling thread between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final int maxAttempts;
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final long jitterMs;
  private final Predicate<UpstreamException> retryable;
  private final Sleeper sleeper;

  @Builder
  private RetryPolicy(
      int maxAttempts,
      long initialDelayMs,
      long maxDelayMs,
      long jitterMs,
      Predicate<UpstreamException> retryable,
      Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
    this.initialDelayMs = initialDelayMs;
    this.maxDelayMs = Math.max(maxDelayMs, initialDelayMs);
    this.jitterMs = jitterMs;
    this.retryable =
        Objects.requireNonNullElse(retryable, e -> e.getKind() == UpstreamException.Kind.UNREACHABLE);
    this.sleeper = Objects.requireNonNullElse(sleeper, Thread::sleep);
  }

  public static RetryPolicy from(ModerationProperties.Retry retry) {
    return RetryPolicy.builder()
        .maxAttempts(retry.getMaxAttempts())
        .initialDelayMs(retry.getInitialDelayMs())
        .maxDelayMs(retry.getMaxDelayMs())
        .jitterMs(retry.getJitterMs())
        .build();
  }

  /**
   * Runs {@code call} until it succeeds, fails with a non-retryable error, or the attempt budget
   * is spent. The thrown exception carries the number of attempts made.
   */
  public <T> GatewayCall<T> execute(String operation, Supplier<T> call) {
    long start = System.nanoTime();
    long delay = initialDelayMs;
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        T value = call.get();
        return new GatewayCall<>(value, attempt, elapsedMs(start));
      } catch (UpstreamException e) {
        e.withAttempts(attempt);
        if (!retryable.test(e)) {
          throw e;
        }
        if (attempt >= maxAttempts) {
          log.error("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
          throw e;
        }

        long wait = delay + (jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0);
        log.warn(
            "{} attempt {}/{} failed ({}), retrying in {} ms",
            operation,
            attempt,
            maxAttempts,
            e.getKind(),
            wait);
        pause(operation, wait, attempt, e);
        delay = Math.min(delay * 2, maxDelayMs);
      }
    }
  }

  private void pause(String operation, long wait, int attempt, UpstreamException cause) {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      UpstreamException interrupted =
          new UpstreamUnreachableException(operation, "Interrupted while backing off", ie);
      interrupted.addSuppressed(cause);
      throw interrupted.withAttempts(attempt);
    }
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
