package com.acme.brickwatch.scheduler.mail;

import com.acme.brickwatch.spi.MailSender;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Fallback transport when no SMTP host is configured: notices go to the log. */
@Singleton
@Requires(missingProperty = "mail.smtp.host")
@Slf4j
public class LoggingMailSender implements MailSender {

  @Override
  public void send(List<String> recipients, String subject, String body) {
    log.info("Mail to {}: {}\n{}", recipients, subject, body);
  }
}
