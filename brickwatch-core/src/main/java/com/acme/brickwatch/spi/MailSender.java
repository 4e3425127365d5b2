package com.acme.brickwatch.spi;

import java.util.List;

/** Outbound mail transport. */
public interface MailSender {

  /**
   * Deliver one plain-text message to all recipients.
   *
   * @throws NotificationSendException if the transport rejects or cannot deliver the message
   */
  void send(List<String> recipients, String subject, String body);
}
