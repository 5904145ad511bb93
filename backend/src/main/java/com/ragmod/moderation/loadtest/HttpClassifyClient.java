package com.ragmod.moderation.loadtest;

import java.io.Closeable;

import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.ragmod.moderation.config.ApiKeyFilter;
import com.ragmod.moderation.config.PooledHttpClients;
import com.ragmod.moderation.dto.ClassifyRequest;
import com.ragmod.moderation.dto.ClassifyResponse;
import com.ragmod.moderation.dto.HealthResponse;

import lombok.extern.slf4j.Slf4j;

/** Sends classification requests to a running server over a pooled HTTP client. */
@Slf4j
public class HttpClassifyClient implements ClassifyClient, Closeable {

  private final String serverUrl;
  private final String apiKey;
  private final RestTemplate restTemplate;
  private final PoolingHttpClientConnectionManager connectionManager;

  public HttpClassifyClient(
      String serverUrl, String apiKey, int poolSize, long requestTimeoutMs, long connectTimeoutMs) {
    this.serverUrl = stripTrailingSlash(serverUrl);
    this.apiKey = apiKey;
    this.connectionManager =
        PooledHttpClients.connectionManager(poolSize, poolSize, connectTimeoutMs, 60);
    this.restTemplate = PooledHttpClients.restTemplate(connectionManager, requestTimeoutMs, 60);
  }

  HttpClassifyClient(String serverUrl, String apiKey, RestTemplate restTemplate) {
    this.serverUrl = stripTrailingSlash(serverUrl);
    this.apiKey = apiKey;
    this.restTemplate = restTemplate;
    this.connectionManager = null;
  }

  @Override
  public ClassifyOutcome classify(ClassifyRequest request) {
    try {
      ResponseEntity<ClassifyResponse> response =
          restTemplate.exchange(
              serverUrl + "/classify",
              HttpMethod.POST,
              new HttpEntity<>(request, headers()),
              ClassifyResponse.class);
      if (response.getBody() == null) {
        return ClassifyOutcome.failure("Empty response body", response.getStatusCode().value());
      }
      return ClassifyOutcome.success(response.getBody());
    } catch (HttpStatusCodeException e) {
      log.debug("Classify request failed with {}: {}", e.getStatusCode(), e.getResponseBodyAsString());
      return ClassifyOutcome.failure(
          e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e.getStatusCode().value());
    } catch (RestClientException e) {
      log.debug("Classify request failed: {}", e.getMessage());
      return ClassifyOutcome.failure(e.getMessage(), null);
    }
  }

  @Override
  public boolean isHealthy() {
    try {
      ResponseEntity<HealthResponse> response =
          restTemplate.exchange(
              serverUrl + "/health",
              HttpMethod.GET,
              new HttpEntity<>(headers()),
              HealthResponse.class);
      HealthResponse health = response.getBody();
      if (health == null) {
        return false;
      }
      log.info(
          "Server {} is {} (index loaded: {}, backend: {}, size: {})",
          serverUrl,
          health.getStatus(),
          health.isIndexLoaded(),
          health.getIndexBackend(),
          health.getIndexSize());
      return "healthy".equals(health.getStatus());
    } catch (RestClientException e) {
      log.error("Health check against {} failed: {}", serverUrl, e.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    if (connectionManager != null) {
      connectionManager.close();
    }
  }

  private HttpHeaders headers() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    if (apiKey != null && !apiKey.isBlank()) {
      headers.set(ApiKeyFilter.API_KEY_HEADER, apiKey);
    }
    return headers;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
