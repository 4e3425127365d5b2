package com.acme.brickwatch.config;

import java.time.Duration;

/** Outbound mail settings. Pure POJO - no framework dependencies. */
public class MailConfig {

  private String sender = "brickwatch@localhost";
  private String senderName = "Brick Watch";
  private int recentEvents = 15;
  private Smtp smtp = new Smtp();

  public String getSender() {
    return sender;
  }

  public void setSender(String sender) {
    this.sender = sender;
  }

  public String getSenderName() {
    return senderName;
  }

  public void setSenderName(String senderName) {
    this.senderName = senderName;
  }

  public int getRecentEvents() {
    return recentEvents;
  }

  public void setRecentEvents(int recentEvents) {
    this.recentEvents = recentEvents;
  }

  public Smtp getSmtp() {
    return smtp;
  }

  public void setSmtp(Smtp smtp) {
    this.smtp = smtp;
  }

  public static class Smtp {
    private String host;
    private int port = 25;
    private String username;
    private String password;
    private boolean startTls;
    private Duration timeout = Duration.ofSeconds(30);

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public boolean isStartTls() {
      return startTls;
    }

    public void setStartTls(boolean startTls) {
      this.startTls = startTls;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public boolean isAuthenticated() {
      return username != null && !username.isBlank();
    }
  }
}
