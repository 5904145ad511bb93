package com.ragmod.moderation.service.gateway;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.ragmod.moderation.config.ModerationProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * The embedding gateway the rest of the application sees. Delegates to the provider named by
 * {@code moderation.embedding.provider} and, when enabled, caches single-text lookups.
 */
@Slf4j
@Primary
@Service
public class EmbeddingGatewaySelector implements EmbeddingGateway {

  private final EmbeddingGateway delegate;
  private final Cache<String, float[]> queryCache;

  public EmbeddingGatewaySelector(
      OpenAiEmbeddingGateway openAiGateway,
      BedrockEmbeddingGateway bedrockGateway,
      ModerationProperties properties) {
    ModerationProperties.Embedding config = properties.getEmbedding();
    this.delegate =
        config.getProvider() == ModerationProperties.EmbeddingProvider.BEDROCK
            ? bedrockGateway
            : openAiGateway;
    this.queryCache = buildCache(config.getCache());
    log.info(
        "Using {} embedding provider with model {} (query cache {})",
        config.getProvider(),
        delegate.getModelId(),
        queryCache != null ? "enabled" : "disabled");
  }

  @Override
  public GatewayCall<List<float[]>> embed(List<String> texts) {
    return delegate.embed(texts);
  }

  @Override
  public GatewayCall<float[]> embedOne(String text) {
    String key = text == null ? "" : text;
    if (queryCache != null) {
      float[] cached = queryCache.getIfPresent(key);
      if (cached != null) {
        return new GatewayCall<>(cached.clone(), 0, 0);
      }
    }
    GatewayCall<float[]> call = delegate.embedOne(key);
    if (queryCache != null) {
      queryCache.put(key, call.getValue().clone());
    }
    return call;
  }

  @Override
  public String getModelId() {
    return delegate.getModelId();
  }

  EmbeddingGateway getDelegate() {
    return delegate;
  }

  private static Cache<String, float[]> buildCache(ModerationProperties.Cache cache) {
    if (!cache.isEnabled()) {
      return null;
    }
    return CacheBuilder.newBuilder()
        .maximumSize(cache.getMaxSize())
        .expireAfterWrite(cache.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
        .build();
  }
}
