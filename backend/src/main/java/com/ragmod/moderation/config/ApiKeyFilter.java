package com.ragmod.moderation.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragmod.moderation.exception.GlobalExceptionHandler.ErrorResponse;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Requires a matching {@code X-API-Key} header when {@code moderation.security.api-key} is set.
 * Health and API documentation stay open.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {

  public static final String API_KEY_HEADER = "X-API-Key";

  private static final List<String> OPEN_PATHS =
      List.of("/health", "/swagger-ui", "/v3/api-docs", "/favicon.ico");

  private final ModerationProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    if (!properties.getSecurity().isEnabled()) {
      return true;
    }
    // CORS preflights never carry the key
    if (HttpMethod.OPTIONS.matches(request.getMethod())) {
      return true;
    }
    String path = request.getRequestURI();
    return "/".equals(path) || OPEN_PATHS.stream().anyMatch(path::startsWith);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String provided = request.getHeader(API_KEY_HEADER);
    if (provided != null && matches(provided, properties.getSecurity().getApiKey())) {
      filterChain.doFilter(request, response);
      return;
    }

    log.warn("Rejected request to {} with missing or invalid API key", request.getRequestURI());
    ErrorResponse body =
        ErrorResponse.of(
                HttpStatus.UNAUTHORIZED, "Invalid or missing API key", request.getRequestURI())
            .build();
    response.setStatus(HttpStatus.UNAUTHORIZED.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }

  private static boolean matches(String provided, String expected) {
    return MessageDigest.isEqual(
        provided.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
  }
}
