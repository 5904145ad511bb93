package com.ragmod.moderation.service.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.ragmod.moderation.RequestMdcFilter;
import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.config.ModerationProperties.IndexBackend;
import com.ragmod.moderation.dto.IndexStatusResponse;
import com.ragmod.moderation.exception.IndexBuildInProgressException;
import com.ragmod.moderation.service.corpus.CorpusLoader;
import com.ragmod.moderation.service.corpus.CorpusRecord;
import com.ragmod.moderation.service.gateway.EmbeddingGateway;
import com.ragmod.moderation.service.gateway.GatewayCall;
import com.ragmod.moderation.service.vector.Example;
import com.ragmod.moderation.service.vector.FlatVectorIndex;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads, builds and reloads the local vector index. Every path ends in a single {@link
 * IndexHolder#install} so requests never see a half-built index. Only one build runs at a time,
 * and writing the index directory plus installing the result never interleaves with a reload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexLifecycleService {

  private final IndexHolder indexHolder;
  private final IndexArtifactStorageService artifactStorage;
  private final CorpusLoader corpusLoader;
  private final EmbeddingGateway embeddingGateway;
  private final ModerationProperties properties;
  private final Executor taskExecutor;

  private final AtomicBoolean building = new AtomicBoolean(false);
  // Guards the index directory and the install that follows reading or writing it
  private final ReentrantLock indexLock = new ReentrantLock();
  private volatile String lastError;

  /** Loads the persisted index once the application is up, downloading it first if configured. */
  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    ModerationProperties.Index index = properties.getIndex();
    if (index.getBackend() == IndexBackend.REMOTE) {
      log.info("Serving from the remote vector index; no local index to load");
      return;
    }
    if (!index.isLoadOnStartup()) {
      log.info("Index loading on startup is disabled");
      return;
    }

    boolean fromArtifacts =
        properties.getArtifacts().isDownloadOnStartup() && artifactStorage.isConfigured();
    if (!fromArtifacts && !hasPersistedIndex(indexDirectory())) {
      log.warn(
          "No persisted index in {}; classification is unavailable until an index is built",
          indexDirectory().toAbsolutePath());
      return;
    }

    try {
      reload(fromArtifacts);
    } catch (IOException | RuntimeException e) {
      lastError = e.getMessage();
      log.error("Failed to load vector index on startup", e);
    }
  }

  /**
   * Reads the persisted index from disk, optionally refreshing it from S3 first, and swaps it in.
   */
  public IndexStatusResponse reload(boolean fromArtifacts) throws IOException {
    Path directory = indexDirectory();
    indexLock.lock();
    try {
      if (fromArtifacts) {
        artifactStorage.download(directory);
      }

      long start = System.currentTimeMillis();
      FlatVectorIndex index = FlatVectorIndex.load(directory);
      indexHolder.install(index);
      lastError = null;
      log.info(
          "Loaded {} examples from {} in {} ms",
          index.size(),
          directory,
          System.currentTimeMillis() - start);
    } finally {
      indexLock.unlock();
    }
    return status();
  }

  /**
   * Starts a build on the task executor, carrying the caller's request id into the worker. The
   * build slot is claimed before this returns.
   *
   * @throws IndexBuildInProgressException if another build is running
   */
  public CompletableFuture<IndexStatusResponse> buildFromCorpusAsync(
      Path corpus, boolean upload) {
    claimBuild();
    String requestId = MDC.get(RequestMdcFilter.REQUEST_ID_MDC_KEY);
    CompletableFuture<IndexStatusResponse> future;
    try {
      future =
          CompletableFuture.supplyAsync(
              () -> {
                try {
                  if (requestId != null) {
                    MDC.put(RequestMdcFilter.REQUEST_ID_MDC_KEY, requestId);
                  }
                  return runClaimedBuild(corpus, upload);
                } catch (IOException e) {
                  throw new CompletionException(e);
                } finally {
                  MDC.remove(RequestMdcFilter.REQUEST_ID_MDC_KEY);
                }
              },
              taskExecutor);
    } catch (RejectedExecutionException e) {
      building.set(false);
      lastError = "Build could not be scheduled: " + e.getMessage();
      throw e;
    }

    return future.whenComplete(
        (status, failure) -> {
          if (failure != null) {
            log.warn(
                "Background index build from {} did not complete: {}",
                corpus,
                failure.getMessage());
          }
        });
  }

  /**
   * Embeds every labeled record of {@code corpus}, persists the new index and installs it.
   * Unlabeled records and records with unknown categories are left out.
   *
   * @throws IndexBuildInProgressException if another build is running
   */
  public IndexStatusResponse buildFromCorpus(Path corpus, boolean upload) throws IOException {
    claimBuild();
    return runClaimedBuild(corpus, upload);
  }

  private void claimBuild() {
    if (!building.compareAndSet(false, true)) {
      throw new IndexBuildInProgressException();
    }
  }

  /** Runs a build whose slot the caller already holds, and releases it. */
  private IndexStatusResponse runClaimedBuild(Path corpus, boolean upload) throws IOException {
    try {
      List<CorpusRecord> records = corpusLoader.load(corpus);
      List<Example> examples = new ArrayList<>();
      List<String> texts = new ArrayList<>();
      for (CorpusRecord record : records) {
        if (record.isLabeled()) {
          examples.add(
              new Example(record.getText(), record.getCategory().get(), record.getMetadata()));
          texts.add(record.getText());
        }
      }
      if (examples.isEmpty()) {
        throw new IllegalArgumentException("Corpus " + corpus + " has no labeled records");
      }
      log.info(
          "Building index from {} labeled examples ({} skipped)",
          examples.size(),
          records.size() - examples.size());

      GatewayCall<List<float[]>> embedded = embeddingGateway.embed(texts);
      FlatVectorIndex index =
          FlatVectorIndex.build(examples, embedded.getValue(), properties.getIndex().getMetric());

      Path directory = indexDirectory();
      indexLock.lock();
      try {
        index.save(directory);
        if (upload && artifactStorage.isConfigured()) {
          artifactStorage.upload(directory);
        }
        indexHolder.install(index);
      } finally {
        indexLock.unlock();
      }
      lastError = null;
      log.info(
          "Index build complete: {} examples, dimension {}, embedding took {} ms over {} call(s)",
          index.size(),
          index.dimension(),
          embedded.getElapsedMs(),
          embedded.getAttempts());
      return status();
    } catch (IOException | RuntimeException e) {
      lastError = e.getMessage();
      log.error("Index build from {} failed", corpus, e);
      throw e;
    } finally {
      building.set(false);
    }
  }

  public IndexStatusResponse status() {
    IndexStatusResponse.IndexStatusResponseBuilder status =
        IndexStatusResponse.builder()
            .backend(properties.getIndex().getBackend().name().toLowerCase(Locale.ROOT))
            .directory(indexDirectory().toString())
            .building(building.get())
            .lastError(lastError);

    indexHolder
        .current()
        .ifPresent(
            index ->
                status
                    .size(index.size())
                    .dimension(index.dimension())
                    .metric(index.metric().name()));
    indexHolder.installedAt().ifPresent(status::installedAt);
    return status.loaded(indexHolder.isLoaded()).build();
  }

  public boolean isBuilding() {
    return building.get();
  }

  private Path indexDirectory() {
    return Paths.get(properties.getIndex().getDirectory());
  }

  private static boolean hasPersistedIndex(Path directory) {
    return FlatVectorIndex.FILES.stream().allMatch(file -> Files.exists(directory.resolve(file)));
  }
}
