package com.acme.brickwatch.schedule;

import java.time.Instant;

/**
 * Outcome of a deadline computation. When {@code effectivelyPaused} is true there is no deadline;
 * {@code resumeAt} is then the instant the schedule becomes active again, or null for a brick
 * that is paused outright.
 */
public record DeadlineResult(Instant deadline, boolean effectivelyPaused, Instant resumeAt) {

  public static DeadlineResult due(Instant deadline) {
    return new DeadlineResult(deadline, false, null);
  }

  public static DeadlineResult paused() {
    return new DeadlineResult(null, true, null);
  }

  public static DeadlineResult gap(Instant resumeAt) {
    return new DeadlineResult(null, true, resumeAt);
  }

  public boolean isGap() {
    return effectivelyPaused && resumeAt != null;
  }
}
