package com.acme.brickwatch.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/** A fixed periodicity that applies at all times. */
public final class ScalarPeriodicity implements Periodicity {

  private static final Pattern DIGITS = Pattern.compile("[+-]?\\d+");

  private final Duration periodicity;

  public ScalarPeriodicity(Duration periodicity) {
    if (periodicity == null || periodicity.isNegative() || periodicity.isZero()) {
      throw new PeriodicityParseException("Periodicity must be positive");
    }
    this.periodicity = periodicity;
  }

  static boolean isScalar(String spec) {
    return DIGITS.matcher(spec).matches();
  }

  static ScalarPeriodicity parse(String spec) {
    return new ScalarPeriodicity(parseSeconds(spec));
  }

  static Duration parseSeconds(String token) {
    long seconds;
    try {
      seconds = Long.parseLong(token.trim());
    } catch (NumberFormatException e) {
      throw new PeriodicityParseException("Invalid periodicity '" + token + "'", e);
    }
    if (seconds <= 0) {
      throw new PeriodicityParseException("Periodicity must be positive, got " + seconds);
    }
    if (seconds > Integer.MAX_VALUE) {
      throw new PeriodicityParseException("Periodicity " + seconds + " is too large");
    }
    return Duration.ofSeconds(seconds);
  }

  public Duration getPeriodicity() {
    return periodicity;
  }

  @Override
  public Optional<Duration> activeAt(Instant time) {
    return Optional.of(periodicity);
  }

  @Override
  public Optional<Instant> nextActivation(Instant from) {
    return Optional.of(from);
  }

  @Override
  public List<ScheduleSegment> materialize(Instant from, Duration minSpan) {
    return List.of();
  }

  @Override
  public String spec() {
    return Long.toString(periodicity.getSeconds());
  }

  @Override
  public boolean isScheduled() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ScalarPeriodicity other && periodicity.equals(other.periodicity);
  }

  @Override
  public int hashCode() {
    return periodicity.hashCode();
  }

  @Override
  public String toString() {
    return spec();
  }
}
