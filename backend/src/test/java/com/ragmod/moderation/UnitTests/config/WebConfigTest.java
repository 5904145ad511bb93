package com.ragmod.moderation.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;

@DisplayName("WebConfig Tests")
class WebConfigTest {

  private ModerationProperties properties;
  private WebConfig webConfig;
  private CorsRegistry registry;
  private CorsRegistration registration;

  @BeforeEach
  void setUp() {
    properties = new ModerationProperties();
    webConfig = new WebConfig(properties);

    registry = mock(CorsRegistry.class);
    registration = mock(CorsRegistration.class);
    when(registry.addMapping("/**")).thenReturn(registration);
    when(registration.allowedOrigins(any(String[].class))).thenReturn(registration);
    when(registration.allowedOriginPatterns(any(String[].class))).thenReturn(registration);
    when(registration.allowedMethods(any(String[].class))).thenReturn(registration);
    when(registration.allowedHeaders(any(String[].class))).thenReturn(registration);
    when(registration.exposedHeaders(any(String[].class))).thenReturn(registration);
    when(registration.allowCredentials(anyBoolean())).thenReturn(registration);
  }

  @Test
  @DisplayName("Should redirect the root path to the API docs")
  void shouldRedirectRootToDocs() {
    ViewControllerRegistry viewRegistry = mock(ViewControllerRegistry.class);

    webConfig.addViewControllers(viewRegistry);

    verify(viewRegistry).addRedirectViewController("/", "/swagger-ui/index.html");
    verify(viewRegistry).setOrder(1);
  }

  @Test
  @DisplayName("Should allow any origin when none are configured")
  void shouldAllowAnyOriginByDefault() {
    webConfig.addCorsMappings(registry);

    verify(registration).allowedOriginPatterns("*");
    verify(registration, never()).allowedOrigins(any(String[].class));
    verify(registration).allowedMethods("GET", "POST", "OPTIONS");
    verify(registration).allowCredentials(false);
  }

  @Test
  @DisplayName("Should restrict origins and expose the request id header")
  void shouldRestrictConfiguredOrigins() {
    properties.getSecurity().setAllowedOrigins(List.of("https://mod.example.com"));

    webConfig.addCorsMappings(registry);

    verify(registration).allowedOrigins("https://mod.example.com");
    verify(registration, never()).allowedOriginPatterns(any(String[].class));
    verify(registration)
        .allowedHeaders("Content-Type", "X-API-Key", "X-Request-Id", "X-Client-Id");
    verify(registration).exposedHeaders("X-Request-Id");
  }
}
