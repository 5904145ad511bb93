package com.ragmod.moderation.exception;

/** A local index build was requested while another one is still running. */
public class IndexBuildInProgressException extends RuntimeException {

  public IndexBuildInProgressException() {
    super("An index build is already in progress");
  }
}
