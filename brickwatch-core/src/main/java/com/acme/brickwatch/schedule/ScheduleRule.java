package com.acme.brickwatch.schedule;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.BitSet;
import lombok.AccessLevel;
import lombok.Getter;

/** One schedule entry: a cron window and the periodicity enforced while it is active. */
@Getter
public final class ScheduleRule {

  private final int position;
  private final String source;
  private final Duration periodicity;

  @Getter(AccessLevel.NONE)
  private final CronPattern pattern;

  private ScheduleRule(int position, String source, CronPattern pattern, Duration periodicity) {
    this.position = position;
    this.source = source;
    this.pattern = pattern;
    this.periodicity = periodicity;
  }

  /**
   * Parses {@code "<minute> <hour> <day-of-month> <month> <day-of-week> <seconds>"}.
   *
   * @param position 1-based position of the rule in its schedule, used in error messages
   */
  static ScheduleRule parse(int position, String source) {
    String[] fields = source.trim().split("\\s+");
    if (fields.length != 6) {
      throw new PeriodicityParseException(
          "Schedule rule " + position + " ('" + source.trim() + "') must have six fields");
    }
    CronPattern pattern;
    try {
      pattern = CronPattern.of(fields[0], fields[1], fields[2], fields[3], fields[4]);
    } catch (PeriodicityParseException e) {
      throw new PeriodicityParseException(
          "Schedule rule " + position + ": " + e.getMessage(), e);
    }
    Duration periodicity = ScalarPeriodicity.parseSeconds(fields[5]);
    return new ScheduleRule(position, String.join(" ", fields), pattern, periodicity);
  }

  boolean isActiveAt(LocalDateTime minute) {
    return pattern.matches(minute);
  }

  boolean isActiveOn(LocalDate date) {
    return pattern.matchesDay(date);
  }

  int nextMinuteOfDay(int fromMinute) {
    return pattern.nextMinuteOfDay(fromMinute);
  }

  BitSet minuteMask() {
    return pattern.minuteMask();
  }

  @Override
  public String toString() {
    return source;
  }
}
