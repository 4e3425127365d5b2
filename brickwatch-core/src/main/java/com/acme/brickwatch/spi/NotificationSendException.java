package com.acme.brickwatch.spi;

public class NotificationSendException extends RuntimeException {
  public NotificationSendException(String message) {
    super(message);
  }

  public NotificationSendException(String message, Throwable e) {
    super(message, e);
  }
}
