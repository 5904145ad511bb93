package com.ragmod.moderation.service.gateway;

import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import com.ragmod.moderation.exception.MalformedUpstreamResponseException;
import com.ragmod.moderation.exception.UpstreamException;
import com.ragmod.moderation.exception.UpstreamRejectedException;
import com.ragmod.moderation.exception.UpstreamUnreachableException;

/** Maps RestTemplate failures onto the upstream error kinds. */
final class UpstreamErrors {

  private static final int MAX_BODY_CHARS = 300;
  private static final int REQUEST_TIMEOUT = 408;

  private UpstreamErrors() {}

  static UpstreamException fromRestClient(String upstream, RestClientException e) {
    if (e instanceof HttpStatusCodeException) {
      HttpStatusCodeException status = (HttpStatusCodeException) e;
      int code = status.getStatusCode().value();
      String detail = "HTTP " + code + " " + abbreviate(status.getResponseBodyAsString());
      // 408: the upstream timed out waiting on us
      if (status.getStatusCode().is5xxServerError() || code == REQUEST_TIMEOUT) {
        return new UpstreamUnreachableException(upstream, detail, e);
      }
      return new UpstreamRejectedException(upstream, code, detail, e);
    }
    if (e instanceof ResourceAccessException) {
      return new UpstreamUnreachableException(upstream, e.getMessage(), e);
    }
    if (e.getCause() instanceof HttpMessageConversionException) {
      return new MalformedUpstreamResponseException(upstream, e.getMessage(), e);
    }
    return new UpstreamUnreachableException(upstream, e.getMessage(), e);
  }

  static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > MAX_BODY_CHARS ? body.substring(0, MAX_BODY_CHARS) + "…" : body;
  }

  static String endpoint(String baseUrl, String path) {
    String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    return base + path;
  }
}
