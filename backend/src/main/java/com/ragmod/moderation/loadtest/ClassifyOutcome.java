package com.ragmod.moderation.loadtest;

import com.ragmod.moderation.dto.ClassifyResponse;

import lombok.Builder;
import lombok.Value;

/** What a single load-test request produced: a response, or the reason there is none. */
@Value
@Builder
public class ClassifyOutcome {

  boolean success;

  /** Present only on success. */
  ClassifyResponse response;

  String error;

  /** HTTP status of a failed call, or null when no response came back. */
  Integer statusCode;

  public static ClassifyOutcome success(ClassifyResponse response) {
    return ClassifyOutcome.builder().success(true).response(response).build();
  }

  public static ClassifyOutcome failure(String error, Integer statusCode) {
    return ClassifyOutcome.builder().success(false).error(error).statusCode(statusCode).build();
  }
}
