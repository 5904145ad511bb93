package com.ragmod.moderation.service.index;

import java.util.List;

import org.springframework.stereotype.Service;

import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.config.ModerationProperties.IndexBackend;
import com.ragmod.moderation.service.gateway.GatewayCall;
import com.ragmod.moderation.service.vector.BigQueryVectorIndex;
import com.ragmod.moderation.service.vector.RetrievedExample;
import com.ragmod.moderation.service.vector.VectorIndex;

import lombok.RequiredArgsConstructor;

/** Sends retrieval to the configured backend: the local index or the warehouse table. */
@Service
@RequiredArgsConstructor
public class VectorIndexRouter {

  private final IndexHolder indexHolder;
  private final BigQueryVectorIndex remoteIndex;
  private final ModerationProperties properties;

  public GatewayCall<List<RetrievedExample>> retrieve(float[] queryVector, int k) {
    if (isRemote()) {
      return remoteIndex.searchWithTelemetry(queryVector, k);
    }
    long start = System.nanoTime();
    List<RetrievedExample> results = indexHolder.require().search(queryVector, k);
    return new GatewayCall<>(results, 1, (System.nanoTime() - start) / 1_000_000);
  }

  public VectorIndex activeIndex() {
    return isRemote() ? remoteIndex : indexHolder.require();
  }

  public boolean isReady() {
    return isRemote() ? remoteIndex.isConfigured() : indexHolder.isLoaded();
  }

  public IndexBackend getBackend() {
    return properties.getIndex().getBackend();
  }

  private boolean isRemote() {
    return properties.getIndex().getBackend() == IndexBackend.REMOTE;
  }
}
