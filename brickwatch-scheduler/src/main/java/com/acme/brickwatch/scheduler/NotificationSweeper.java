package com.acme.brickwatch.scheduler;

import com.acme.brickwatch.config.SchedulerConfig;
import com.acme.brickwatch.repository.BrickRepository;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backstop for notification delivery: recovers claims abandoned by crashed processes and retries
 * notices whose send failed.
 */
@Singleton
@Requires(property = "scheduler.enabled", notEquals = "false")
public class NotificationSweeper {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationSweeper.class);

  private final BrickRepository repository;
  private final NotificationCoordinator coordinator;
  private final SchedulerConfig config;
  private final Clock clock;

  public NotificationSweeper(
      BrickRepository repository,
      NotificationCoordinator coordinator,
      SchedulerConfig config,
      Clock clock) {
    this.repository = repository;
    this.coordinator = coordinator;
    this.config = config;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelay = "${scheduler.notification-sweep-interval:30s}",
      initialDelay = "${scheduler.notification-sweep-interval:30s}")
  public void tick() {
    try {
      int recovered =
          repository.recoverStaleClaims(clock.instant().minus(config.getNotificationClaimTimeout()));
      if (recovered > 0) {
        LOG.info("Recovered {} stale notification claims", recovered);
      }

      int sent = coordinator.retryPending();
      if (sent > 0) {
        LOG.info("Delivered {} pending notifications", sent);
      }
    } catch (Exception e) {
      LOG.error("Error in NotificationSweeper tick: {}", e.getMessage(), e);
    }
  }
}
