package com.acme.brickwatch.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Maximum allowed time between two triggers of a brick. Either a fixed number of seconds or a
 * cron-style schedule whose rules each carry their own periodicity.
 */
public interface Periodicity {

  /** One week, the window shown when a schedule is materialized for display. */
  Duration DISPLAY_SPAN = Duration.ofDays(7);

  /**
   * Parses a periodicity specification: a positive integer number of seconds, or a
   * semicolon-separated list of {@code "<minute> <hour> <day-of-month> <month> <day-of-week>
   * <seconds>"} rules that never overlap.
   *
   * @throws PeriodicityParseException if the specification is malformed
   * @throws ScheduleConflictException if two rules are active during the same minute
   */
  static Periodicity parse(String spec) {
    if (spec == null || spec.isBlank()) {
      throw new PeriodicityParseException("Periodicity must not be empty");
    }
    String trimmed = spec.trim();
    if (ScalarPeriodicity.isScalar(trimmed)) {
      return ScalarPeriodicity.parse(trimmed);
    }
    return ScheduledPeriodicity.parse(trimmed);
  }

  /** Periodicity in force during the UTC minute containing {@code time}, empty in a gap. */
  Optional<Duration> activeAt(Instant time);

  /** First instant at or after {@code from} at which some rule is active. */
  Optional<Instant> nextActivation(Instant from);

  /**
   * Rule-change boundaries from {@code from} onward, until every rule has appeared and at least
   * {@code minSpan} is covered. Scalar periodicities have no boundaries.
   */
  List<ScheduleSegment> materialize(Instant from, Duration minSpan);

  /** Canonical textual form, suitable for storage and re-parsing. */
  String spec();

  boolean isScheduled();
}
