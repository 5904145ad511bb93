package com.ragmod.moderation.service.index;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;

import com.ragmod.moderation.exception.IndexNotReadyException;
import com.ragmod.moderation.service.vector.FlatVectorIndex;

import lombok.extern.slf4j.Slf4j;

/**
 * The single indirection through which requests reach the local index. A {@link FlatVectorIndex}
 * carries its own example store, so installing one replaces vectors and examples together and a
 * reader always sees one complete pair.
 */
@Slf4j
@Component
public class IndexHolder {

  private final AtomicReference<Installed> current = new AtomicReference<>();

  public Optional<FlatVectorIndex> current() {
    Installed installed = current.get();
    return installed == null ? Optional.empty() : Optional.of(installed.index);
  }

  /** The installed index, failing when there is none or it holds nothing. */
  public FlatVectorIndex require() {
    Installed installed = current.get();
    if (installed == null || installed.index.size() == 0) {
      throw new IndexNotReadyException(
          "No vector index is loaded; build or reload the index first");
    }
    return installed.index;
  }

  /** Swaps in {@code index} and returns the one it replaced, if any. */
  public Optional<FlatVectorIndex> install(FlatVectorIndex index) {
    Installed previous = current.getAndSet(new Installed(index, Instant.now()));
    log.info(
        "Installed vector index: {} examples, dimension {}, metric {}",
        index.size(),
        index.dimension(),
        index.metric());
    return previous == null ? Optional.empty() : Optional.of(previous.index);
  }

  public boolean isLoaded() {
    Installed installed = current.get();
    return installed != null && installed.index.size() > 0;
  }

  public Optional<Instant> installedAt() {
    Installed installed = current.get();
    return installed == null ? Optional.empty() : Optional.of(installed.at);
  }

  private static final class Installed {
    final FlatVectorIndex index;
    final Instant at;

    Installed(FlatVectorIndex index, Instant at) {
      this.index = index;
      this.at = at;
    }
  }
}
