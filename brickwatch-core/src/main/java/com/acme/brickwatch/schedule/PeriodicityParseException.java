package com.acme.brickwatch.schedule;

/** A periodicity specification that is malformed or can never take effect. */
public class PeriodicityParseException extends IllegalArgumentException {
  public PeriodicityParseException(String message) {
    super(message);
  }

  public PeriodicityParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
