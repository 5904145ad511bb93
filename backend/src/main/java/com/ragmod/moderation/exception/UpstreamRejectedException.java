package com.ragmod.moderation.exception;

import lombok.Getter;

@Getter
public class UpstreamRejectedException extends UpstreamException {

  /** HTTP status reported by the upstream, or 0 when the rejection was not an HTTP response. */
  private final int statusCode;

  public UpstreamRejectedException(
      String upstream, int statusCode, String message, Throwable cause) {
    super(upstream, message, cause);
    this.statusCode = statusCode;
  }

  @Override
  public Kind getKind() {
    return Kind.REJECTED;
  }
}
