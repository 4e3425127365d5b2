package com.acme.brickwatch.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.BitSet;

/**
 * Five-field cron pattern evaluated at minute resolution. Day matching follows the usual cron
 * convention: when both day-of-month and day-of-week are restricted, a day matches if either one
 * does.
 */
final class CronPattern {

  static final int MINUTES_PER_DAY = 1440;

  private final CronField minute;
  private final CronField hour;
  private final CronField dayOfMonth;
  private final CronField month;
  private final CronField dayOfWeek;
  private final BitSet minuteMask;

  private CronPattern(
      CronField minute, CronField hour, CronField dayOfMonth, CronField month, CronField dayOfWeek) {
    this.minute = minute;
    this.hour = hour;
    this.dayOfMonth = dayOfMonth;
    this.month = month;
    this.dayOfWeek = dayOfWeek;
    this.minuteMask = new BitSet(MINUTES_PER_DAY);
    for (int h = hour.values().nextSetBit(0); h >= 0; h = hour.values().nextSetBit(h + 1)) {
      BitSet minutes = minute.values();
      for (int m = minutes.nextSetBit(0); m >= 0; m = minutes.nextSetBit(m + 1)) {
        minuteMask.set(h * 60 + m);
      }
    }
  }

  static CronPattern of(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {
    return new CronPattern(
        CronField.minutes(minute),
        CronField.hours(hour),
        CronField.daysOfMonth(dayOfMonth),
        CronField.months(month),
        CronField.daysOfWeek(dayOfWeek));
  }

  boolean matchesDay(LocalDate date) {
    if (!month.matches(date.getMonthValue())) {
      return false;
    }
    boolean domMatches = dayOfMonth.matches(date.getDayOfMonth());
    boolean dowMatches = dayOfWeek.matches(date.getDayOfWeek().getValue() % 7);
    if (dayOfMonth.isWildcard() || dayOfWeek.isWildcard()) {
      return domMatches && dowMatches;
    }
    return domMatches || dowMatches;
  }

  boolean matches(LocalDateTime time) {
    return matchesDay(time.toLocalDate())
        && minuteMask.get(time.getHour() * 60 + time.getMinute());
  }

  /** First active minute-of-day at or after {@code fromMinute}, or -1. */
  int nextMinuteOfDay(int fromMinute) {
    return minuteMask.nextSetBit(fromMinute);
  }

  BitSet minuteMask() {
    return (BitSet) minuteMask.clone();
  }
}
