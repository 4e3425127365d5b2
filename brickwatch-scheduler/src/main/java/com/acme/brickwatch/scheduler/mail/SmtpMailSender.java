package com.acme.brickwatch.scheduler.mail;

import com.acme.brickwatch.config.MailConfig;
import com.acme.brickwatch.spi.MailSender;
import com.acme.brickwatch.spi.NotificationSendException;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends notices through an SMTP relay configured under {@code mail.smtp}. */
@Singleton
@Requires(property = "mail.smtp.host")
public class SmtpMailSender implements MailSender {

  private static final Logger LOG = LoggerFactory.getLogger(SmtpMailSender.class);

  private final MailConfig config;
  private final Session session;

  public SmtpMailSender(MailConfig config) {
    this.config = config;
    MailConfig.Smtp smtp = config.getSmtp();
    Properties props = smtpProperties(smtp);
    this.session =
        smtp.isAuthenticated()
            ? Session.getInstance(
                props,
                new Authenticator() {
                  @Override
                  protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(smtp.getUsername(), smtp.getPassword());
                  }
                })
            : Session.getInstance(props);
    LOG.info("SMTP mail sender using {}:{}", smtp.getHost(), smtp.getPort());
  }

  static Properties smtpProperties(MailConfig.Smtp smtp) {
    String timeout = String.valueOf(smtp.getTimeout().toMillis());
    Properties props = new Properties();
    props.put("mail.smtp.host", smtp.getHost());
    props.put("mail.smtp.port", String.valueOf(smtp.getPort()));
    props.put("mail.smtp.auth", String.valueOf(smtp.isAuthenticated()));
    props.put("mail.smtp.starttls.enable", String.valueOf(smtp.isStartTls()));
    props.put("mail.smtp.connectiontimeout", timeout);
    props.put("mail.smtp.timeout", timeout);
    props.put("mail.smtp.writetimeout", timeout);
    return props;
  }

  @Override
  public void send(List<String> recipients, String subject, String body) {
    try {
      MimeMessage message = new MimeMessage(session);
      message.setFrom(new InternetAddress(config.getSender(), config.getSenderName(), "UTF-8"));
      message.setRecipients(
          Message.RecipientType.TO, InternetAddress.parse(String.join(",", recipients)));
      message.setSubject(subject, StandardCharsets.UTF_8.name());
      message.setSentDate(new Date());
      message.setText(body, StandardCharsets.UTF_8.name());
      Transport.send(message);
      LOG.debug("Mail '{}' sent to {}", subject, recipients);
    } catch (MessagingException | UnsupportedEncodingException e) {
      throw new NotificationSendException(
          "SMTP delivery of '" + subject + "' via " + config.getSmtp().getHost() + " failed", e);
    }
  }
}
