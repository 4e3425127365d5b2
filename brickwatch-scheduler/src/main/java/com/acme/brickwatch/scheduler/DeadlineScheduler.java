package com.acme.brickwatch.scheduler;

import com.acme.brickwatch.config.SchedulerConfig;
import com.acme.brickwatch.core.TransientException;
import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.TransitionKind;
import com.acme.brickwatch.domain.WakeTarget;
import com.acme.brickwatch.repository.BrickRepository;
import com.acme.brickwatch.schedule.DeadlineCalculator;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide wake loop over the deadlines of active bricks.
 *
 * <p>The queue is a disposable cache of {@code (wakeAt, brickId)} pairs. It is rebuilt from the
 * store every resync interval, and every wake re-reads the due bricks from the store before
 * changing them. Mutations that move a deadline call {@link #scheduleBrick} or {@link
 * #unscheduleBrick}, which signal the loop so the wait is recomputed at once.
 */
@Singleton
public class DeadlineScheduler implements ApplicationEventListener<StartupEvent>, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(DeadlineScheduler.class);
  private static final Comparator<WakeTarget> ORDER =
      Comparator.comparing(WakeTarget::wakeAt).thenComparing(WakeTarget::brickId);

  private final BrickRepository repository;
  private final DeadlineCalculator calculator;
  private final NotificationCoordinator coordinator;
  private final SchedulerConfig config;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final NavigableSet<WakeTarget> queue = new TreeSet<>(ORDER);
  private final Map<String, WakeTarget> index = new HashMap<>();
  private final List<DeadlineChangeListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean running = new AtomicBoolean(false);

  // Loop thread only
  private final Map<String, Duration> brickBackoff = new HashMap<>();
  private final Map<String, Instant> brickRetryAt = new HashMap<>();
  private Duration storeBackoff;

  // Guarded by lock
  private Instant nextResync = Instant.MIN;
  private Instant retryAt;

  private Thread thread;

  public DeadlineScheduler(
      BrickRepository repository,
      DeadlineCalculator calculator,
      NotificationCoordinator coordinator,
      SchedulerConfig config,
      Clock clock) {
    this.repository = repository;
    this.calculator = calculator;
    this.coordinator = coordinator;
    this.config = config;
    this.clock = clock;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    if (config.isEnabled()) {
      start();
    } else {
      LOG.info("Deadline scheduler disabled (scheduler.enabled=false)");
    }
  }

  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    thread = new Thread(this::runLoop, "deadline-scheduler");
    thread.setDaemon(true);
    thread.start();
    LOG.info("Deadline scheduler started, resync every {}", config.getResyncInterval());
  }

  /** Stops the loop; a wait in progress is cancelled and nothing is written. */
  @Override
  @PreDestroy
  public synchronized void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    LOG.info("Shutting down deadline scheduler");
    signal();
    try {
      thread.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public void addListener(DeadlineChangeListener listener) {
    listeners.add(listener);
  }

  /** Arms or moves the wake target of a brick and tells listeners about it. */
  public void scheduleBrick(String brickId, Instant wakeAt) {
    rearm(brickId, wakeAt);
    publish(brickId, wakeAt);
  }

  public void unscheduleBrick(String brickId) {
    rearm(brickId, null);
    publish(brickId, null);
  }

  /** Changes the local queue only; used for changes that other processes announced. */
  void rearm(String brickId, Instant wakeAt) {
    lock.lock();
    try {
      WakeTarget first = queue.isEmpty() ? null : queue.first();
      WakeTarget previous = index.remove(brickId);
      if (previous != null) {
        queue.remove(previous);
      }
      if (wakeAt != null) {
        WakeTarget target = new WakeTarget(brickId, wakeAt);
        index.put(brickId, target);
        queue.add(target);
      }
      WakeTarget newFirst = queue.isEmpty() ? null : queue.first();
      if (newFirst != null && (first == null || newFirst.wakeAt().isBefore(first.wakeAt()))) {
        changed.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  Optional<Instant> wakeTargetOf(String brickId) {
    lock.lock();
    try {
      return Optional.ofNullable(index.get(brickId)).map(WakeTarget::wakeAt);
    } finally {
      lock.unlock();
    }
  }

  Optional<Instant> earliestWake() {
    lock.lock();
    try {
      return queue.isEmpty() ? Optional.empty() : Optional.of(queue.first().wakeAt());
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return index.size();
    } finally {
      lock.unlock();
    }
  }

  private void publish(String brickId, Instant wakeAt) {
    for (DeadlineChangeListener listener : listeners) {
      try {
        listener.onDeadlineChanged(brickId, wakeAt);
      } catch (RuntimeException e) {
        LOG.warn("Deadline listener failed for brick id={}: {}", brickId, e.getMessage());
      }
    }
  }

  private void signal() {
    lock.lock();
    try {
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  // Loop

  private void runLoop() {
    while (running.get()) {
      try {
        awaitWake();
        if (!running.get()) {
          break;
        }
        Instant now = clock.instant();
        if (!now.isBefore(nextResyncAt())) {
          resync(now);
        }
        reconcileDue(now);
        storeBackoff = null;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException e) {
        storeBackoff = config.nextBackoff(storeBackoff);
        LOG.error("Deadline scheduler cycle failed, retrying in {}: {}", storeBackoff, e.getMessage(), e);
        setRetryAt(clock.instant().plus(storeBackoff));
      }
    }
    LOG.info("Deadline scheduler stopped");
  }

  private void awaitWake() throws InterruptedException {
    lock.lock();
    try {
      while (running.get()) {
        Instant now = clock.instant();
        Instant wakeAt = nextResync;
        if (!queue.isEmpty() && queue.first().wakeAt().isBefore(wakeAt)) {
          wakeAt = queue.first().wakeAt();
        }
        if (retryAt != null && retryAt.isBefore(wakeAt)) {
          wakeAt = retryAt;
        }
        if (!wakeAt.isAfter(now)) {
          retryAt = null;
          return;
        }
        changed.awaitNanos(Duration.between(now, wakeAt).toNanos());
      }
    } finally {
      lock.unlock();
    }
  }

  private Instant nextResyncAt() {
    lock.lock();
    try {
      return nextResync;
    } finally {
      lock.unlock();
    }
  }

  private void setRetryAt(Instant at) {
    lock.lock();
    try {
      retryAt = at;
    } finally {
      lock.unlock();
    }
  }

  /** Rebuilds the queue from the store, keeping per-brick retry delays. */
  void resync(Instant now) {
    List<WakeTarget> active = repository.listActive();
    lock.lock();
    try {
      queue.clear();
      index.clear();
      for (WakeTarget target : active) {
        Instant delayed = brickRetryAt.get(target.brickId());
        WakeTarget effective =
            delayed != null && delayed.isAfter(target.wakeAt())
                ? new WakeTarget(target.brickId(), delayed)
                : target;
        index.put(effective.brickId(), effective);
        queue.add(effective);
      }
      nextResync = now.plus(config.getResyncInterval());
    } finally {
      lock.unlock();
    }
    LOG.debug("Resynced deadline queue with {} active bricks", active.size());
  }

  /**
   * Evaluates every brick whose wake target has passed: flips due bricks to late and resumes
   * bricks whose schedule gap has ended. A brick that fails is re-armed with backoff; a failed
   * store read puts the expired entries back and propagates.
   */
  void reconcileDue(Instant now) {
    List<WakeTarget> expired = takeExpired(now);
    List<Brick> due;
    try {
      due = repository.findWithDeadlineBefore(now, config.getReconcileBatchSize());
    } catch (RuntimeException e) {
      expired.forEach(t -> rearm(t.brickId(), t.wakeAt()));
      throw e;
    }

    for (Brick brick : due) {
      String id = brick.getId();
      try {
        reconcile(brick, now);
        brickBackoff.remove(id);
        brickRetryAt.remove(id);
      } catch (RuntimeException e) {
        Duration backoff = config.nextBackoff(brickBackoff.get(id));
        brickBackoff.put(id, backoff);
        brickRetryAt.put(id, now.plus(backoff));
        rearm(id, now.plus(backoff));
        LOG.warn("Failed to reconcile brick id={}, retrying in {}: {}", id, backoff, e.getMessage());
      }
    }

    if (due.size() >= config.getReconcileBatchSize()) {
      setRetryAt(now);
      return;
    }
    Set<String> seen = due.stream().map(Brick::getId).collect(Collectors.toSet());
    for (WakeTarget target : expired) {
      if (!seen.contains(target.brickId())) {
        refresh(target, now);
      }
    }
  }

  // The entry was stale: the store holds a later deadline, another state, or no brick at all
  private void refresh(WakeTarget target, Instant now) {
    try {
      repository.findById(target.brickId()).ifPresent(brick -> rearmFrom(brick, now));
    } catch (RuntimeException e) {
      LOG.warn("Failed to refresh wake target of brick id={}, next resync restores it: {}",
          target.brickId(), e.getMessage());
    }
  }

  private List<WakeTarget> takeExpired(Instant now) {
    lock.lock();
    try {
      List<WakeTarget> expired = new ArrayList<>();
      while (!queue.isEmpty() && !queue.first().wakeAt().isAfter(now)) {
        WakeTarget target = queue.pollFirst();
        index.remove(target.brickId());
        expired.add(target);
      }
      return expired;
    } finally {
      lock.unlock();
    }
  }

  private void reconcile(Brick loaded, Instant now) {
    Brick brick = loaded;
    for (int attempt = 1; attempt <= BrickServiceImpl.MAX_ATTEMPTS; attempt++) {
      long version = brick.getVersion();
      boolean becameLate = brick.markLate(now);
      boolean resumed =
          !becameLate
              && brick.resumeFromGap(
                  now,
                  calculator.nextDeadline(brick.getResumeAt(), brick.parsedPeriodicity(), false));
      if (!becameLate && !resumed) {
        rearmFrom(brick, now);
        return;
      }

      if (repository.update(brick, version)) {
        rearmFrom(brick, now);
        if (becameLate) {
          LOG.info("Brick id={} name='{}' is late, deadline was {}", brick.getId(), brick.getName(), brick.getDeadline());
          coordinator.dispatch(brick.getId(), TransitionKind.BECAME_LATE);
        } else {
          LOG.info("Brick id={} left its schedule gap, deadline {}", brick.getId(), brick.getDeadline());
        }
        return;
      }

      Optional<Brick> reread = repository.findById(brick.getId());
      if (reread.isEmpty()) {
        return;
      }
      brick = reread.get();
    }
    throw new TransientException("Brick " + loaded.getId() + " kept changing during reconciliation");
  }

  private void rearmFrom(Brick brick, Instant now) {
    Instant wakeAt = brick.wakeTarget();
    if (wakeAt != null && !wakeAt.isAfter(now) && brick.getDeadline() == null) {
      // A gap whose end already passed but did not resolve: avoid a hot loop
      wakeAt = now.plus(config.getInitialBackoff());
    }
    rearm(brick.getId(), wakeAt);
  }
}
