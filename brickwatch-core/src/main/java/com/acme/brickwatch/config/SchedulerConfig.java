package com.acme.brickwatch.config;

import java.time.Duration;

/**
 * Timing and batching settings for the deadline scheduler and notification delivery. Pure POJO -
 * no framework dependencies.
 */
public class SchedulerConfig {

  private boolean enabled = true;
  private Duration resyncInterval = Duration.ofSeconds(30); // Backstop rebuild of the wake queue
  private Duration initialBackoff = Duration.ofSeconds(1);
  private Duration maxBackoff = Duration.ofMinutes(5);
  private int reconcileBatchSize = 500;
  private Duration notificationSweepInterval = Duration.ofSeconds(30);
  private Duration notificationClaimTimeout = Duration.ofMinutes(5);
  private int notificationBatchSize = 100;
  private int notificationThreads = 4;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getResyncInterval() {
    return resyncInterval;
  }

  public void setResyncInterval(Duration resyncInterval) {
    this.resyncInterval = resyncInterval;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public int getReconcileBatchSize() {
    return reconcileBatchSize;
  }

  public void setReconcileBatchSize(int reconcileBatchSize) {
    this.reconcileBatchSize = reconcileBatchSize;
  }

  public Duration getNotificationSweepInterval() {
    return notificationSweepInterval;
  }

  public void setNotificationSweepInterval(Duration notificationSweepInterval) {
    this.notificationSweepInterval = notificationSweepInterval;
  }

  public Duration getNotificationClaimTimeout() {
    return notificationClaimTimeout;
  }

  public void setNotificationClaimTimeout(Duration notificationClaimTimeout) {
    this.notificationClaimTimeout = notificationClaimTimeout;
  }

  public int getNotificationBatchSize() {
    return notificationBatchSize;
  }

  public void setNotificationBatchSize(int notificationBatchSize) {
    this.notificationBatchSize = notificationBatchSize;
  }

  public int getNotificationThreads() {
    return notificationThreads;
  }

  public void setNotificationThreads(int notificationThreads) {
    this.notificationThreads = notificationThreads;
  }

  /**
   * Doubles the previous backoff, starting at {@link #getInitialBackoff()} and capped at {@link
   * #getMaxBackoff()}.
   */
  public Duration nextBackoff(Duration previous) {
    if (previous == null || previous.isZero()) {
      return initialBackoff;
    }
    Duration doubled = previous.multipliedBy(2);
    return doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
  }
}
