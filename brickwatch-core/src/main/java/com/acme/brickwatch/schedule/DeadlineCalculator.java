package com.acme.brickwatch.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the next deadline of a brick from its last event and periodicity.
 *
 * <p>The periodicity in force at the reference time governs the whole interval: a deadline that
 * runs into a stricter or looser rule window is not clamped to that window's boundary.
 */
public class DeadlineCalculator {

  private static final Logger LOG = LoggerFactory.getLogger(DeadlineCalculator.class);

  /**
   * @param lastEventTime reference time, usually the latest trigger or "now"
   * @param periodicity parsed periodicity of the brick
   * @param wasPaused whether the brick is paused by an operator
   * @return the deadline, or an effectively paused result; for a schedule gap the result carries
   *     the instant the schedule becomes active again
   */
  public DeadlineResult nextDeadline(Instant lastEventTime, Periodicity periodicity, boolean wasPaused) {
    if (wasPaused) {
      return DeadlineResult.paused();
    }

    Optional<Duration> active = periodicity.activeAt(lastEventTime);
    if (active.isPresent()) {
      return DeadlineResult.due(lastEventTime.plus(active.get()));
    }

    Optional<Instant> resumeAt = periodicity.nextActivation(lastEventTime);
    if (resumeAt.isEmpty()) {
      LOG.warn("Schedule '{}' has no upcoming active rule after {}", periodicity.spec(), lastEventTime);
      return DeadlineResult.paused();
    }
    return DeadlineResult.gap(resumeAt.get());
  }
}
