package com.acme.brickwatch.scheduler;

import com.acme.brickwatch.core.Jsons;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.UUID;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shares wake-target changes between server processes over a Redis topic so that a peer re-arms
 * its queue at once instead of waiting for the next resync. Losing a message only delays the
 * peer until that resync.
 */
@Context
@Requires(beans = RedissonClient.class)
public class RedisDeadlineBroadcaster implements DeadlineChangeListener, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(RedisDeadlineBroadcaster.class);
  static final String TOPIC = "brickwatch:deadline";

  record DeadlineChange(String origin, String brickId, Instant wakeAt) {}

  private final DeadlineScheduler scheduler;
  private final RTopic topic;
  private final String origin = UUID.randomUUID().toString();
  private final int listenerId;

  public RedisDeadlineBroadcaster(RedissonClient redisson, DeadlineScheduler scheduler) {
    this.scheduler = scheduler;
    this.topic = redisson.getTopic(TOPIC);
    this.listenerId = topic.addListener(String.class, (channel, message) -> onMessage(message));
    scheduler.addListener(this);
    LOG.info("Broadcasting deadline changes on Redis topic {} as {}", TOPIC, origin);
  }

  @Override
  public void onDeadlineChanged(String brickId, Instant wakeAt) {
    try {
      topic.publishAsync(Jsons.toJson(new DeadlineChange(origin, brickId, wakeAt)));
    } catch (RuntimeException e) {
      LOG.warn("Failed to broadcast deadline change for brick id={}: {}", brickId, e.getMessage());
    }
  }

  void onMessage(String message) {
    try {
      DeadlineChange change = Jsons.fromJson(message, DeadlineChange.class);
      if (origin.equals(change.origin())) {
        return;
      }
      scheduler.rearm(change.brickId(), change.wakeAt());
      LOG.debug("Peer {} moved brick id={} to {}", change.origin(), change.brickId(), change.wakeAt());
    } catch (RuntimeException e) {
      LOG.warn("Ignoring malformed deadline message '{}': {}", message, e.getMessage());
    }
  }

  @Override
  @PreDestroy
  public void close() {
    topic.removeListener(listenerId);
  }
}
