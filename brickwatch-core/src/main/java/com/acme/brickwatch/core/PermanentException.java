package com.acme.brickwatch.core;

/** Non-retryable failure: schema problems, constraint violations, malformed data. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
