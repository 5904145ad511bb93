package com.ragmod.moderation.service.gateway;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.exception.MalformedUpstreamResponseException;

import lombok.extern.slf4j.Slf4j;

/**
 * Embedding client for servers speaking the OpenAI {@code /embeddings} protocol. Large inputs are
 * split into batches; every batch gets its own retry budget.
 */
@Slf4j
@Service
public class OpenAiEmbeddingGateway implements EmbeddingGateway {

  static final String UPSTREAM = "embedding";

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final ModerationProperties.Embedding config;
  private final RetryPolicy retryPolicy;

  @Autowired
  public OpenAiEmbeddingGateway(
      @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
      ObjectMapper objectMapper,
      ModerationProperties properties) {
    this(
        restTemplate,
        objectMapper,
        properties.getEmbedding(),
        RetryPolicy.from(properties.getRetry()));
  }

  OpenAiEmbeddingGateway(
      RestTemplate restTemplate,
      ObjectMapper objectMapper,
      ModerationProperties.Embedding config,
      RetryPolicy retryPolicy) {
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
    this.config = config;
    this.retryPolicy = retryPolicy;
  }

  @Override
  public GatewayCall<List<float[]>> embed(List<String> texts) {
    if (texts.isEmpty()) {
      return new GatewayCall<>(List.of(), 0, 0);
    }

    int batchSize = Math.max(1, config.getBatchSize());
    List<float[]> vectors = new ArrayList<>(texts.size());
    int attempts = 0;
    long elapsed = 0;
    for (int from = 0; from < texts.size(); from += batchSize) {
      List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
      GatewayCall<List<float[]>> call =
          retryPolicy.execute("embedding request", () -> requestEmbeddings(batch));
      vectors.addAll(call.getValue());
      attempts += call.getAttempts();
      elapsed += call.getElapsedMs();
    }
    log.debug("Embedded {} texts with model {} in {} ms", texts.size(), config.getModel(), elapsed);
    return new GatewayCall<>(vectors, attempts, elapsed);
  }

  @Override
  public String getModelId() {
    return config.getModel();
  }

  private List<float[]> requestEmbeddings(List<String> batch) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", config.getModel());
    ArrayNode input = body.putArray("input");
    batch.forEach(text -> input.add(text == null ? "" : text));

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
      headers.setBearerAuth(config.getApiKey());
    }

    ResponseEntity<String> response;
    try {
      response =
          restTemplate.exchange(
              UpstreamErrors.endpoint(config.getBaseUrl(), "/embeddings"),
              HttpMethod.POST,
              new HttpEntity<>(body.toString(), headers),
              String.class);
    } catch (RestClientException e) {
      throw UpstreamErrors.fromRestClient(UPSTREAM, e);
    }
    return parseEmbeddings(response.getBody(), batch.size());
  }

  private List<float[]> parseEmbeddings(String body, int expected) {
    if (body == null || body.isBlank()) {
      throw new MalformedUpstreamResponseException(UPSTREAM, "Empty response body");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException e) {
      throw new MalformedUpstreamResponseException(UPSTREAM, "Response is not JSON", e);
    }

    JsonNode data = root.get("data");
    if (data == null || !data.isArray()) {
      throw new MalformedUpstreamResponseException(UPSTREAM, "Response has no 'data' array");
    }
    if (data.size() != expected) {
      throw new MalformedUpstreamResponseException(
          UPSTREAM, String.format("Expected %d embeddings but got %d", expected, data.size()));
    }

    float[][] ordered = new float[expected][];
    for (int i = 0; i < data.size(); i++) {
      JsonNode item = data.get(i);
      // Servers may report an explicit position; fall back to array order
      int position = item.path("index").isInt() ? item.get("index").asInt() : i;
      JsonNode embedding = item.get("embedding");
      if (embedding == null || !embedding.isArray() || embedding.isEmpty()) {
        throw new MalformedUpstreamResponseException(
            UPSTREAM, "Item " + i + " has no 'embedding' array");
      }
      if (position < 0 || position >= expected || ordered[position] != null) {
        throw new MalformedUpstreamResponseException(
            UPSTREAM, "Item " + i + " has invalid index " + position);
      }
      float[] vector = new float[embedding.size()];
      for (int j = 0; j < vector.length; j++) {
        JsonNode component = embedding.get(j);
        if (!component.isNumber()) {
          throw new MalformedUpstreamResponseException(
              UPSTREAM, "Item " + i + " has a non-numeric component");
        }
        vector[j] = component.floatValue();
      }
      ordered[position] = vector;
    }
    return new ArrayList<>(Arrays.asList(ordered));
  }
}
