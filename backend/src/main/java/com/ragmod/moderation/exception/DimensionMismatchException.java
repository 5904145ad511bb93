package com.ragmod.moderation.exception;

import lombok.Getter;

/** A vector whose length does not match the index dimension. */
@Getter
public class DimensionMismatchException extends RuntimeException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super(String.format("Expected vector of dimension %d but got %d", expected, actual));
    this.expected = expected;
    this.actual = actual;
  }
}
