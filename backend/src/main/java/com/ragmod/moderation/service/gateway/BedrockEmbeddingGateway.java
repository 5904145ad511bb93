package com.ragmod.moderation.service.gateway;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.exception.MalformedUpstreamResponseException;
import com.ragmod.moderation.exception.UpstreamException;
import com.ragmod.moderation.exception.UpstreamRejectedException;
import com.ragmod.moderation.exception.UpstreamUnreachableException;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/**
 * Embeddings from Amazon Titan on AWS Bedrock. Titan takes one text per call, so a batch becomes a
 * sequence of calls. The SDK's own retries are disabled so that {@link RetryPolicy} alone decides.
 */
@Slf4j
@Service
public class BedrockEmbeddingGateway implements EmbeddingGateway {

  static final String UPSTREAM = "bedrock-embedding";

  private final ObjectMapper objectMapper;
  private final ModerationProperties.Embedding config;
  private final RetryPolicy retryPolicy;

  private volatile BedrockRuntimeClient bedrockClient;

  @Autowired
  public BedrockEmbeddingGateway(ObjectMapper objectMapper, ModerationProperties properties) {
    this(objectMapper, properties.getEmbedding(), RetryPolicy.from(properties.getRetry()), null);
  }

  BedrockEmbeddingGateway(
      ObjectMapper objectMapper,
      ModerationProperties.Embedding config,
      RetryPolicy retryPolicy,
      BedrockRuntimeClient bedrockClient) {
    this.objectMapper = objectMapper;
    this.config = config;
    this.retryPolicy = retryPolicy;
    this.bedrockClient = bedrockClient;
  }

  @Override
  public GatewayCall<List<float[]>> embed(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    int attempts = 0;
    long elapsed = 0;
    for (String text : texts) {
      GatewayCall<float[]> call =
          retryPolicy.execute("bedrock embedding", () -> invoke(text == null ? "" : text));
      vectors.add(call.getValue());
      attempts += call.getAttempts();
      elapsed += call.getElapsedMs();
    }
    return new GatewayCall<>(vectors, attempts, elapsed);
  }

  @Override
  public String getModelId() {
    return config.getBedrockModelId();
  }

  @PreDestroy
  public void close() {
    if (bedrockClient != null) {
      bedrockClient.close();
    }
  }

  private float[] invoke(String text) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(Map.of("inputText", text));
    } catch (IOException e) {
      throw new IllegalStateException("Could not serialize embedding request", e);
    }

    InvokeModelResponse response;
    try {
      response =
          client()
              .invokeModel(
                  InvokeModelRequest.builder()
                      .modelId(config.getBedrockModelId())
                      .contentType("application/json")
                      .accept("application/json")
                      .body(SdkBytes.fromString(payload, StandardCharsets.UTF_8))
                      .build());
    } catch (SdkException e) {
      throw classify(e);
    }

    try {
      JsonNode embedding = objectMapper.readTree(response.body().asUtf8String()).get("embedding");
      if (embedding == null || !embedding.isArray() || embedding.isEmpty()) {
        throw new MalformedUpstreamResponseException(UPSTREAM, "Response has no 'embedding'");
      }
      float[] vector = new float[embedding.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = embedding.get(i).floatValue();
      }
      return vector;
    } catch (IOException e) {
      throw new MalformedUpstreamResponseException(UPSTREAM, "Response is not JSON", e);
    }
  }

  static UpstreamException classify(SdkException e) {
    if (e instanceof AwsServiceException) {
      int status = ((AwsServiceException) e).statusCode();
      if (status >= 500) {
        return new UpstreamUnreachableException(UPSTREAM, e.getMessage(), e);
      }
      return new UpstreamRejectedException(UPSTREAM, status, e.getMessage(), e);
    }
    if (e instanceof SdkClientException) {
      return new UpstreamUnreachableException(UPSTREAM, e.getMessage(), e);
    }
    return new UpstreamUnreachableException(UPSTREAM, e.getMessage(), e);
  }

  private BedrockRuntimeClient client() {
    BedrockRuntimeClient client = bedrockClient;
    if (client == null) {
      synchronized (this) {
        if (bedrockClient == null) {
          bedrockClient =
              BedrockRuntimeClient.builder()
                  .region(Region.of(config.getBedrockRegion()))
                  .credentialsProvider(DefaultCredentialsProvider.create())
                  .overrideConfiguration(
                      c ->
                          c.apiCallTimeout(Duration.ofMillis(config.getTimeoutMs()))
                              .retryPolicy(software.amazon.awssdk.core.retry.RetryPolicy.none()))
                  .build();
          log.info(
              "Bedrock embedding client initialized for region {} with model {}",
              config.getBedrockRegion(),
              config.getBedrockModelId());
        }
        client = bedrockClient;
      }
    }
    return client;
  }
}
