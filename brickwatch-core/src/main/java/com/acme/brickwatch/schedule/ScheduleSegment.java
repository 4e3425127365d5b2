package com.acme.brickwatch.schedule;

import java.time.Duration;
import java.time.Instant;

/**
 * A run of consecutive minutes governed by the same rule, end exclusive. A null periodicity marks
 * a gap in which no rule is active.
 */
public record ScheduleSegment(Instant start, Instant end, Duration periodicity) {

  public boolean isGap() {
    return periodicity == null;
  }
}
