package com.ragmod.moderation;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  public static final String REQUEST_ID_MDC_KEY = "requestId";
  public static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String CLIENT_MDC_KEY = "client";
  public static final String CLIENT_HEADER = "X-Client-Id";
  private static final String DEFAULT_CLIENT = "anonymous";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String client = request.getHeader(CLIENT_HEADER);
      if (client == null || client.isEmpty()) {
        client = DEFAULT_CLIENT;
      }
      MDC.put(CLIENT_MDC_KEY, client);

      // Echo the request id so callers can correlate their logs with ours
      String requestId = request.getHeader(REQUEST_ID_HEADER);
      if (requestId == null || requestId.isEmpty()) {
        requestId = UUID.randomUUID().toString();
      }
      MDC.put(REQUEST_ID_MDC_KEY, requestId);
      response.setHeader(REQUEST_ID_HEADER, requestId);

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CLIENT_MDC_KEY);
      MDC.remove(REQUEST_ID_MDC_KEY);
    }
  }
}
