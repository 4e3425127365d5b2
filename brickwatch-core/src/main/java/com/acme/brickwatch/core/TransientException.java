package com.acme.brickwatch.core;

/** Retryable failure of a collaborator, typically the backing store. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
