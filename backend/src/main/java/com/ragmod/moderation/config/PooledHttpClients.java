package com.ragmod.moderation.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Factory for RestTemplates backed by a shared, bounded Apache HttpClient connection pool. Several
 * templates can share one pool while keeping their own response timeout.
 */
public final class PooledHttpClients {

  private PooledHttpClients() {}

  public static PoolingHttpClientConnectionManager connectionManager(
      int maxTotal, int maxPerRoute, long connectTimeoutMs, long keepAliveSeconds) {
    ConnectionConfig connectionConfig =
        ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
            .setTimeToLive(TimeValue.ofSeconds(keepAliveSeconds))
            .build();

    return PoolingHttpClientConnectionManagerBuilder.create()
        .setMaxConnTotal(maxTotal)
        .setMaxConnPerRoute(maxPerRoute)
        .setDefaultConnectionConfig(connectionConfig)
        .build();
  }

  /**
   * A RestTemplate over the given pool. Waiting for a pooled connection counts against the same
   * timeout as the response itself.
   */
  public static RestTemplate restTemplate(
      PoolingHttpClientConnectionManager connectionManager,
      long responseTimeoutMs,
      long keepAliveSeconds) {
    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
            .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
            .build();

    CloseableHttpClient httpClient =
        HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setConnectionManagerShared(true)
            .setDefaultRequestConfig(requestConfig)
            .evictIdleConnections(TimeValue.ofSeconds(keepAliveSeconds))
            .disableAutomaticRetries()
            .build();

    return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
  }
}
