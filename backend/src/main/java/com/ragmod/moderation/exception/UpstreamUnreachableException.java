package com.ragmod.moderation.exception;

public class UpstreamUnreachableException extends UpstreamException {

  public UpstreamUnreachableException(String upstream, String message, Throwable cause) {
    super(upstream, message, cause);
  }

  @Override
  public Kind getKind() {
    return Kind.UNREACHABLE;
  }
}
