package com.ragmod.moderation.service.gateway;

import java.util.List;

/** Turns text into dense vectors by calling an external embedding model. */
public interface EmbeddingGateway {

  /**
   * Embeds every text, returning one vector per input in input order.
   *
   * @throws com.ragmod.moderation.exception.UpstreamException when the upstream fails or answers
   *     with the wrong number of vectors
   */
  GatewayCall<List<float[]>> embed(List<String> texts);

  default GatewayCall<float[]> embedOne(String text) {
    GatewayCall<List<float[]>> call = embed(List.of(text == null ? "" : text));
    return new GatewayCall<>(call.getValue().get(0), call.getAttempts(), call.getElapsedMs());
  }

  String getModelId();
}
