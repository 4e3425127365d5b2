package com.acme.brickwatch.scheduler;

import com.acme.brickwatch.config.SchedulerConfig;
import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.TransitionKind;
import com.acme.brickwatch.repository.BrickRepository;
import com.acme.brickwatch.spi.MailSender;
import com.acme.brickwatch.spi.NotificationSendException;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers at most one notice per late/recovered transition across all processes sharing the
 * store. A process may only send after winning the conditional claim on the brick row; a failed
 * send gives the claim back so the sweeper retries it.
 */
@Singleton
public class NotificationCoordinator implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationCoordinator.class);

  private final BrickRepository repository;
  private final MailSender mailSender;
  private final NotificationComposer composer;
  private final SchedulerConfig config;
  private final Clock clock;
  private final ExecutorService executor;

  public NotificationCoordinator(
      BrickRepository repository,
      MailSender mailSender,
      NotificationComposer composer,
      SchedulerConfig config,
      Clock clock) {
    this.repository = repository;
    this.mailSender = mailSender;
    this.composer = composer;
    this.config = config;
    this.clock = clock;
    this.executor = Executors.newFixedThreadPool(config.getNotificationThreads(), daemonThreads());
  }

  /** Hands the transition to the notification executor; never blocks the caller on mail. */
  public void dispatch(String brickId, TransitionKind kind) {
    try {
      executor.execute(() -> notify(brickId, kind));
    } catch (RejectedExecutionException e) {
      LOG.warn("Notification executor rejected {} for brick id={}; left for the sweeper", kind, brickId);
    }
  }

  /**
   * Claims and sends the notice for one transition.
   *
   * @return true if this call delivered the notice (or completed it for a brick without
   *     recipients)
   */
  public boolean notify(String brickId, TransitionKind kind) {
    String token = UUID.randomUUID().toString();
    boolean expectedLate = kind == TransitionKind.BECAME_LATE;
    try {
      if (!repository.claimNotification(brickId, expectedLate, token, clock.instant())) {
        LOG.debug("Notification {} for brick id={} already claimed or superseded", kind, brickId);
        return false;
      }
    } catch (RuntimeException e) {
      LOG.warn("Failed to claim {} notification for brick id={}: {}", kind, brickId, e.getMessage());
      return false;
    }

    Brick brick;
    NotificationComposer.Message message;
    try {
      Optional<Brick> found = repository.findById(brickId);
      if (found.isEmpty()) {
        LOG.debug("Brick id={} deleted before its {} notification was sent", brickId, kind);
        return false;
      }
      brick = found.get();
      if (brick.getEmails().isEmpty()) {
        repository.completeNotification(brickId, token);
        LOG.info("No emails for brick {} ({}), {} notice skipped", brick.getName(), brickId, kind);
        return true;
      }
      message = composer.compose(brick, kind);
      mailSender.send(brick.getEmails(), message.subject(), message.body());
    } catch (NotificationSendException e) {
      LOG.warn("Failed to send {} notification for brick id={}, will retry: {}", kind, brickId, e.getMessage());
      release(brickId, token);
      return false;
    } catch (RuntimeException e) {
      LOG.error("Error preparing {} notification for brick id={}: {}", kind, brickId, e.getMessage(), e);
      release(brickId, token);
      return false;
    }

    try {
      repository.completeNotification(brickId, token);
    } catch (RuntimeException e) {
      LOG.error(
          "Sent '{}' for brick id={} but could not record delivery: {}",
          message.subject(),
          brickId,
          e.getMessage());
    }
    LOG.info("Sent '{}' for brick id={} to {} recipient(s)", message.subject(), brickId, brick.getEmails().size());
    return true;
  }

  /**
   * Retries every unclaimed pending notice. The notice sent matches the brick's current late
   * state, so a transition that was reversed before delivery only produces the latest notice.
   */
  public int retryPending() {
    List<Brick> pending = repository.findPendingNotifications(config.getNotificationBatchSize());
    int sent = 0;
    for (Brick brick : pending) {
      if (notify(brick.getId(), TransitionKind.forLate(brick.isLate()))) {
        sent++;
      }
    }
    return sent;
  }

  private void release(String brickId, String token) {
    try {
      if (!repository.releaseNotification(brickId, token)) {
        LOG.debug("Claim {} on brick id={} was already recovered", token, brickId);
      }
    } catch (RuntimeException e) {
      LOG.warn(
          "Could not release notification claim on brick id={}; it will be recovered after {}: {}",
          brickId,
          config.getNotificationClaimTimeout(),
          e.getMessage());
    }
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "notification-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  @Override
  @PreDestroy
  public void close() {
    LOG.info("Shutting down notification executor");
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
