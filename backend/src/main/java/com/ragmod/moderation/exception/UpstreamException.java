package com.ragmod.moderation.exception;

import lombok.Getter;

/**
 * Failure of a call to an external capability (embedding, generation, warehouse search). The
 * {@link Kind} tells callers whether retrying could have helped.
 */
@Getter
public abstract class UpstreamException extends RuntimeException {

  public enum Kind {
    /** Connection failure, timeout, 408 or 5xx. Retryable. */
    UNREACHABLE,
    /** Any other 4xx, including quota and auth. Never retried. */
    REJECTED,
    /** A 2xx answer without the expected content. Never retried. */
    MALFORMED
  }

  private final String upstream;
  private int attempts;

  protected UpstreamException(String upstream, String message, Throwable cause) {
    super(message, cause);
    this.upstream = upstream;
    this.attempts = 1;
  }

  public abstract Kind getKind();

  /** Records how many calls were made before giving up. */
  public UpstreamException withAttempts(int attempts) {
    this.attempts = attempts;
    return this;
  }

  @Override
  public String getMessage() {
    return String.format(
        "%s %s after %d attempt(s): %s", upstream, getKind(), attempts, super.getMessage());
  }
}
