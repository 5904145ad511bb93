package com.ragmod.moderation.config;

import java.util.concurrent.Executor;

import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
@EnableAsync
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  /** Runs index builds and reloads off the request thread. */
  @Bean
  public Executor taskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(10);
    executor.setThreadNamePrefix("index-");
    executor.initialize();
    return executor;
  }

  @Bean(destroyMethod = "close")
  public PoolingHttpClientConnectionManager upstreamConnectionManager(
      ModerationProperties properties) {
    ModerationProperties.Http http = properties.getHttp();
    return PooledHttpClients.connectionManager(
        http.getMaxTotal(),
        http.getMaxPerRoute(),
        http.getConnectTimeoutMs(),
        http.getKeepAliveSeconds());
  }

  @Bean
  public RestTemplate embeddingRestTemplate(
      @Qualifier("upstreamConnectionManager") PoolingHttpClientConnectionManager connectionManager,
      ModerationProperties properties) {
    return PooledHttpClients.restTemplate(
        connectionManager,
        properties.getEmbedding().getTimeoutMs(),
        properties.getHttp().getKeepAliveSeconds());
  }

  @Bean
  public RestTemplate generationRestTemplate(
      @Qualifier("upstreamConnectionManager") PoolingHttpClientConnectionManager connectionManager,
      ModerationProperties properties) {
    return PooledHttpClients.restTemplate(
        connectionManager,
        properties.getGeneration().getTimeoutMs(),
        properties.getHttp().getKeepAliveSeconds());
  }
}
