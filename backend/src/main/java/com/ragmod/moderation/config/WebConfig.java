package com.ragmod.moderation.config;

import java.util.List;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.ragmod.moderation.RequestMdcFilter;

import lombok.RequiredArgsConstructor;

/** Browser access to the classification API and a landing redirect to the API docs. */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

  static final String[] ALLOWED_METHODS = {"GET", "POST", "OPTIONS"};
  static final String[] ALLOWED_HEADERS = {
    "Content-Type",
    ApiKeyFilter.API_KEY_HEADER,
    RequestMdcFilter.REQUEST_ID_HEADER,
    RequestMdcFilter.CLIENT_HEADER
  };

  private final ModerationProperties properties;

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> origins = properties.getSecurity().getAllowedOrigins();
    CorsRegistration mapping = registry.addMapping("/**");
    if (origins == null || origins.isEmpty()) {
      mapping.allowedOriginPatterns("*");
    } else {
      mapping.allowedOrigins(origins.toArray(new String[0]));
    }

    // No credentials: callers authenticate with the API key header
    mapping
        .allowedMethods(ALLOWED_METHODS)
        .allowedHeaders(ALLOWED_HEADERS)
        .exposedHeaders(RequestMdcFilter.REQUEST_ID_HEADER)
        .allowCredentials(false);
  }
}
