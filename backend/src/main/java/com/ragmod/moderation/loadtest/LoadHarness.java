package com.ragmod.moderation.loadtest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.RateLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.ragmod.moderation.dto.ClassifyRequest;
import com.ragmod.moderation.service.corpus.CorpusRecord;
import com.ragmod.moderation.service.gateway.RetryPolicy;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives classification requests at a controlled concurrency and aggregates the results.
 *
 * <p>A run starts one worker thread per concurrency slot. Workers must hold a permit of a shared
 * semaphore for each request; it starts with one permit and the rest are released linearly over
 * the ramp-up, so in-flight requests grow from 1 to the target. Each worker picks a random corpus
 * item per iteration. At the deadline no new request is started but in-flight ones complete and
 * count.
 */
@Slf4j
public class LoadHarness {

  private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofMinutes(2);

  private final ClassifyClient client;
  private final List<CorpusRecord> corpus;
  private final Integer numExamples;
  private final Integer maxTextLength;
  private final long seed;
  private final Duration drainTimeout;
  private final RetryPolicy.Sleeper sleeper;

  @Builder
  private LoadHarness(
      ClassifyClient client,
      List<CorpusRecord> corpus,
      Integer numExamples,
      Integer maxTextLength,
      Long seed,
      Duration drainTimeout,
      RetryPolicy.Sleeper sleeper) {
    Preconditions.checkNotNull(client, "client");
    Preconditions.checkArgument(corpus != null && !corpus.isEmpty(), "Corpus must not be empty");
    this.client = client;
    this.corpus = List.copyOf(corpus);
    this.numExamples = numExamples;
    this.maxTextLength = maxTextLength;
    this.seed = seed != null ? seed : System.nanoTime();
    this.drainTimeout = drainTimeout != null ? drainTimeout : DEFAULT_DRAIN_TIMEOUT;
    this.sleeper = sleeper != null ? sleeper : Thread::sleep;
  }

  public LoadTestMetrics run(int concurrency, Duration duration, Duration rampUp) {
    return run(concurrency, duration, rampUp, 0);
  }

  /**
   * Runs one load test.
   *
   * @param requestsPerSecond global cap on request starts across all workers; 0 for none
   */
  public LoadTestMetrics run(
      int concurrency, Duration duration, Duration rampUp, double requestsPerSecond) {
    Preconditions.checkArgument(concurrency >= 1, "Concurrency must be at least 1");
    Preconditions.checkArgument(
        duration != null && !duration.isNegative() && !duration.isZero(),
        "Duration must be positive");
    Duration ramp = rampUp == null || rampUp.isNegative() ? Duration.ZERO : rampUp;
    Preconditions.checkArgument(requestsPerSecond >= 0, "Rate must not be negative");

    boolean ramping = concurrency > 1 && !ramp.isZero();
    Semaphore gate = new Semaphore(ramping ? 1 : concurrency);
    RateLimiter limiter = requestsPerSecond > 0 ? RateLimiter.create(requestsPerSecond) : null;
    MetricsAccumulator metrics = new MetricsAccumulator();

    log.info(
        "Starting load test: concurrency={}, duration={}s, ramp-up={}s, rate={}",
        concurrency,
        duration.toSeconds(),
        ramp.toSeconds(),
        limiter != null ? requestsPerSecond + "/s" : "unlimited");

    ExecutorService workers =
        Executors.newFixedThreadPool(
            concurrency,
            new ThreadFactoryBuilder().setNameFormat("load-worker-%d").setDaemon(true).build());
    long start = System.nanoTime();
    long deadline = start + duration.toNanos();
    for (int i = 0; i < concurrency; i++) {
      Random random = new Random(seed + i);
      workers.execute(() -> workerLoop(gate, limiter, metrics, random, deadline));
    }
    workers.shutdown();

    if (ramping) {
      rampUp(gate, concurrency, ramp, start, deadline);
    }
    drain(workers, deadline);

    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    LoadTestMetrics result = metrics.toMetrics(concurrency, elapsed, ramp);
    log.info(
        "Load test at concurrency {} finished: {} requests, {} req/s, p50={} ms, p95={} ms, error rate={}",
        concurrency,
        result.getTotalRequests(),
        String.format("%.2f", result.getRequestsPerSecond()),
        String.format("%.1f", result.getP50LatencyMs()),
        String.format("%.1f", result.getP95LatencyMs()),
        String.format("%.3f", result.getErrorRate()));
    return result;
  }

  public List<LoadTestMetrics> runScaling(
      List<Integer> levels, Duration durationPerLevel, Duration cooldown) {
    return runScaling(levels, durationPerLevel, Duration.ZERO, cooldown, 0);
  }

  /** Runs each level in the given order, pausing {@code cooldown} between consecutive levels. */
  public List<LoadTestMetrics> runScaling(
      List<Integer> levels,
      Duration durationPerLevel,
      Duration rampUp,
      Duration cooldown,
      double requestsPerSecond) {
    Preconditions.checkArgument(levels != null && !levels.isEmpty(), "No concurrency levels");
    List<LoadTestMetrics> results = new ArrayList<>(levels.size());
    for (int i = 0; i < levels.size(); i++) {
      if (i > 0 && cooldown != null && !cooldown.isZero() && !cooldown.isNegative()) {
        log.info("Cooling down for {}s", cooldown.toSeconds());
        try {
          sleeper.sleep(cooldown.toMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          log.warn("Scaling test interrupted after {} of {} levels", i, levels.size());
          break;
        }
      }
      results.add(run(levels.get(i), durationPerLevel, rampUp, requestsPerSecond));
    }
    return results;
  }

  /** The level with the highest throughput; the earliest wins a tie. */
  public static Optional<LoadTestMetrics> peakThroughput(List<LoadTestMetrics> results) {
    LoadTestMetrics best = null;
    for (LoadTestMetrics m : results) {
      if (best == null || m.getRequestsPerSecond() > best.getRequestsPerSecond()) {
        best = m;
      }
    }
    return Optional.ofNullable(best);
  }

  private void workerLoop(
      Semaphore gate,
      RateLimiter limiter,
      MetricsAccumulator metrics,
      Random random,
      long deadline) {
    try {
      while (System.nanoTime() < deadline) {
        if (!gate.tryAcquire(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)) {
          return;
        }
        try {
          if (limiter != null) {
            limiter.acquire();
          }
          if (System.nanoTime() >= deadline) {
            return;
          }
          CorpusRecord item = corpus.get(random.nextInt(corpus.size()));
          long started = System.nanoTime();
          ClassifyOutcome outcome = send(item);
          metrics.record(
              outcome, (System.nanoTime() - started) / 1_000_000.0, item.getCategory().orElse(null));
        } finally {
          gate.release();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private ClassifyOutcome send(CorpusRecord item) {
    ClassifyRequest request =
        ClassifyRequest.builder()
            .text(item.getText())
            .numExamples(numExamples)
            .maxTextLength(maxTextLength)
            .build();
    try {
      return client.classify(request);
    } catch (RuntimeException e) {
      log.debug("Classify client threw: {}", e.toString());
      return ClassifyOutcome.failure(e.toString(), null);
    }
  }

  /** Releases one extra permit at each step {@code rampUp * j / (concurrency - 1)}. */
  private void rampUp(Semaphore gate, int concurrency, Duration rampUp, long start, long deadline) {
    int released = 0;
    try {
      for (int j = 1; j < concurrency; j++) {
        long releaseAt = start + rampUp.toNanos() * j / (concurrency - 1);
        if (releaseAt >= deadline) {
          break;
        }
        long waitMs = TimeUnit.NANOSECONDS.toMillis(releaseAt - System.nanoTime());
        if (waitMs > 0) {
          sleeper.sleep(waitMs);
        }
        gate.release();
        released++;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.debug("Ramp-up released {} of {} extra permits", released, concurrency - 1);
  }

  private void drain(ExecutorService workers, long deadline) {
    long waitNanos = Math.max(0, deadline - System.nanoTime()) + drainTimeout.toNanos();
    try {
      if (!workers.awaitTermination(waitNanos, TimeUnit.NANOSECONDS)) {
        log.warn("Workers still busy {}s after the deadline; abandoning them", drainTimeout.toSeconds());
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }
}
