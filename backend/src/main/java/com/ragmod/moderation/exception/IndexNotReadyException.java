package com.ragmod.moderation.exception;

/** The vector index was never built or loaded, or holds no examples. */
public class IndexNotReadyException extends RuntimeException {

  public IndexNotReadyException(String message) {
    super(message);
  }
}
