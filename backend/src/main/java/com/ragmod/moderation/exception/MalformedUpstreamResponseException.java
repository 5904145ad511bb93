package com.ragmod.moderation.exception;

public class MalformedUpstreamResponseException extends UpstreamException {

  public MalformedUpstreamResponseException(String upstream, String message) {
    super(upstream, message, null);
  }

  public MalformedUpstreamResponseException(String upstream, String message, Throwable cause) {
    super(upstream, message, cause);
  }

  @Override
  public Kind getKind() {
    return Kind.MALFORMED;
  }
}
