package com.ragmod.moderation.service.gateway;

import java.io.IOException;

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

/** Generation client for servers speaking the OpenAI {@code /chat/completions} protocol. */
@Slf4j
@Service
public class ChatCompletionsGenerationGateway implements GenerationGateway {

  static final String UPSTREAM = "generation";

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final ModerationProperties.Generation config;
  private final RetryPolicy retryPolicy;

  @Autowired
  public ChatCompletionsGenerationGateway(
      @Qualifier("generationRestTemplate") RestTemplate restTemplate,
      ObjectMapper objectMapper,
      ModerationProperties properties) {
    this(
        restTemplate,
        objectMapper,
        properties.getGeneration(),
        RetryPolicy.from(properties.getRetry()));
  }

  ChatCompletionsGenerationGateway(
      RestTemplate restTemplate,
      ObjectMapper objectMapper,
      ModerationProperties.Generation config,
      RetryPolicy retryPolicy) {
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
    this.config = config;
    this.retryPolicy = retryPolicy;
  }

  @Override
  public GatewayCall<String> generate(String systemPrompt, String userPrompt, int maxTokens) {
    int tokens = maxTokens > 0 ? maxTokens : config.getMaxTokens();
    String requestBody = buildRequest(systemPrompt, userPrompt, tokens);

    log.debug(
        "Generation request model={}, maxTokens={}, prompt length={} chars",
        config.getModel(),
        tokens,
        userPrompt.length());
    return retryPolicy.execute("generation request", () -> send(requestBody));
  }

  @Override
  public String getModelId() {
    return config.getModel();
  }

  private String buildRequest(String systemPrompt, String userPrompt, int maxTokens) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", config.getModel());
    body.put("temperature", config.getTemperature());
    body.put("max_tokens", maxTokens);

    ArrayNode messages = body.putArray("messages");
    if (systemPrompt != null && !systemPrompt.isEmpty()) {
      messages.addObject().put("role", "system").put("content", systemPrompt);
    }
    messages.addObject().put("role", "user").put("content", userPrompt);
    return body.toString();
  }

  private String send(String requestBody) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
      headers.setBearerAuth(config.getApiKey());
    }

    ResponseEntity<String> response;
    try {
      response =
          restTemplate.exchange(
              UpstreamErrors.endpoint(config.getBaseUrl(), "/chat/completions"),
              HttpMethod.POST,
              new HttpEntity<>(requestBody, headers),
              String.class);
    } catch (RestClientException e) {
      throw UpstreamErrors.fromRestClient(UPSTREAM, e);
    }
    return extractContent(response.getBody());
  }

  private String extractContent(String body) {
    if (body == null || body.isBlank()) {
      throw new MalformedUpstreamResponseException(UPSTREAM, "Empty response body");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException e) {
      throw new MalformedUpstreamResponseException(UPSTREAM, "Response is not JSON", e);
    }

    JsonNode content = root.path("choices").path(0).path("message").path("content");
    if (!content.isTextual()) {
      log.error(
          "Generation response without choices[0].message.content: {}",
          UpstreamErrors.abbreviate(body));
      throw new MalformedUpstreamResponseException(
          UPSTREAM, "Response has no choices[0].message.content");
    }
    return content.asText().trim();
  }
}
