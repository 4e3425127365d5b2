package com.acme.brickwatch.scheduler.mail;

import static org.assertj.core.api.Assertions.*;

import com.acme.brickwatch.config.MailConfig;
import com.acme.brickwatch.spi.NotificationSendException;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SmtpMailSenderTest {

  @Test
  @DisplayName("should map SMTP settings to session properties")
  void testProperties() {
    // Given
    MailConfig.Smtp smtp = new MailConfig.Smtp();
    smtp.setHost("smtp.example.com");
    smtp.setPort(587);
    smtp.setUsername("mailer");
    smtp.setStartTls(true);
    smtp.setTimeout(Duration.ofSeconds(5));

    // When
    Properties props = SmtpMailSender.smtpProperties(smtp);

    // Then
    assertThat(props.getProperty("mail.smtp.host")).isEqualTo("smtp.example.com");
    assertThat(props.getProperty("mail.smtp.port")).isEqualTo("587");
    assertThat(props.getProperty("mail.smtp.auth")).isEqualTo("true");
    assertThat(props.getProperty("mail.smtp.starttls.enable")).isEqualTo("true");
    assertThat(props.getProperty("mail.smtp.connectiontimeout")).isEqualTo("5000");
  }

  @Test
  @DisplayName("an unreachable relay should raise NotificationSendException")
  void testUnreachableRelay() {
    // Given
    MailConfig config = new MailConfig();
    config.getSmtp().setHost("127.0.0.1");
    config.getSmtp().setPort(1);
    config.getSmtp().setTimeout(Duration.ofSeconds(2));
    SmtpMailSender sender = new SmtpMailSender(config);

    // When / Then
    assertThatThrownBy(() -> sender.send(List.of("ops@example.com"), "[LATE] x", "body"))
        .isInstanceOf(NotificationSendException.class)
        .hasMessageContaining("127.0.0.1");
  }
}
