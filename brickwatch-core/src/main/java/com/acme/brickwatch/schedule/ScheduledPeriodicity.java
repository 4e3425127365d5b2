package com.acme.brickwatch.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Periodicity that varies over time according to cron-style rules. All evaluation happens in UTC
 * at minute resolution.
 *
 * <p>Rules are validated for overlap by projecting each one onto two independent grids: the 1440
 * minutes of a day, and the days of a 28-year calendar cycle (every combination of weekday, date
 * and leap year). Cron minute matching never depends on the date, so two rules overlap exactly when
 * both projections intersect.
 */
public final class ScheduledPeriodicity implements Periodicity {

  static final LocalDate CYCLE_START = LocalDate.of(2000, 1, 1);
  static final int CYCLE_DAYS = (int) ChronoUnit.DAYS.between(CYCLE_START, CYCLE_START.plusYears(28));

  /** Upper bound for materialization. */
  static final int MAX_SCAN_DAYS = 366;

  /** Upper bound for activation lookups; long enough to reach a Feb 29 across a skipped leap year. */
  static final int MAX_ACTIVATION_SCAN_DAYS = 366 * 8;

  private static final char RULE_SEPARATOR = ';';

  private final List<ScheduleRule> rules;

  private ScheduledPeriodicity(List<ScheduleRule> rules) {
    this.rules = List.copyOf(rules);
  }

  static ScheduledPeriodicity parse(String spec) {
    if (spec.indexOf('\n') >= 0 || spec.indexOf('\r') >= 0) {
      throw new PeriodicityParseException("Schedule must not contain newlines; separate rules with ';'");
    }
    List<ScheduleRule> rules = new ArrayList<>();
    for (String entry : spec.split(String.valueOf(RULE_SEPARATOR))) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      rules.add(ScheduleRule.parse(rules.size() + 1, trimmed));
    }
    if (rules.isEmpty()) {
      throw new PeriodicityParseException("Schedule contains no rules");
    }
    validate(rules);
    return new ScheduledPeriodicity(rules);
  }

  private static void validate(List<ScheduleRule> rules) {
    List<BitSet> dayMasks = new ArrayList<>(rules.size());
    List<BitSet> minuteMasks = new ArrayList<>(rules.size());
    for (ScheduleRule rule : rules) {
      BitSet days = new BitSet(CYCLE_DAYS);
      LocalDate date = CYCLE_START;
      for (int i = 0; i < CYCLE_DAYS; i++, date = date.plusDays(1)) {
        if (rule.isActiveOn(date)) {
          days.set(i);
        }
      }
      BitSet minutes = rule.minuteMask();
      if (days.isEmpty() || minutes.isEmpty()) {
        throw new PeriodicityParseException(
            "Schedule rule " + rule.getPosition() + " ('" + rule.getSource() + "') is never active");
      }
      dayMasks.add(days);
      minuteMasks.add(minutes);
    }

    for (int i = 0; i < rules.size(); i++) {
      for (int j = i + 1; j < rules.size(); j++) {
        if (minuteMasks.get(i).intersects(minuteMasks.get(j))
            && dayMasks.get(i).intersects(dayMasks.get(j))) {
          throw new ScheduleConflictException(rules.get(i), rules.get(j));
        }
      }
    }
  }

  public List<ScheduleRule> getRules() {
    return rules;
  }

  @Override
  public Optional<Duration> activeAt(Instant time) {
    LocalDateTime minute = toUtcMinute(time);
    for (ScheduleRule rule : rules) {
      if (rule.isActiveAt(minute)) {
        return Optional.of(rule.getPeriodicity());
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<Instant> nextActivation(Instant from) {
    if (activeAt(from).isPresent()) {
      return Optional.of(from);
    }
    LocalDateTime start = toUtcMinute(from).plusMinutes(1);
    LocalDate date = start.toLocalDate();
    int fromMinute = start.getHour() * 60 + start.getMinute();
    for (int day = 0; day < MAX_ACTIVATION_SCAN_DAYS; day++, date = date.plusDays(1)) {
      int earliest = -1;
      for (ScheduleRule rule : rules) {
        if (!rule.isActiveOn(date)) {
          continue;
        }
        int minute = rule.nextMinuteOfDay(fromMinute);
        if (minute >= 0 && (earliest < 0 || minute < earliest)) {
          earliest = minute;
        }
      }
      if (earliest >= 0) {
        return Optional.of(date.atStartOfDay().plusMinutes(earliest).toInstant(ZoneOffset.UTC));
      }
      fromMinute = 0;
    }
    return Optional.empty();
  }

  @Override
  public List<ScheduleSegment> materialize(Instant from, Duration minSpan) {
    LocalDateTime cursor = toUtcMinute(from);
    long wantedMinutes = Math.max(1, minSpan.toMinutes());
    long stopMinutes = MAX_SCAN_DAYS * (long) CronPattern.MINUTES_PER_DAY;

    LocalDate day = cursor.toLocalDate();
    int minute = cursor.getHour() * 60 + cursor.getMinute();
    int[] slots = slotsFor(day);

    List<ScheduleSegment> segments = new ArrayList<>();
    BitSet seen = new BitSet(rules.size());
    LocalDateTime runStart = cursor;
    int runRule = slots[minute];
    long elapsed = 0;

    while (true) {
      elapsed++;
      minute++;
      if (minute == CronPattern.MINUTES_PER_DAY) {
        day = day.plusDays(1);
        minute = 0;
        slots = slotsFor(day);
      }
      int rule = slots[minute];
      boolean covered = elapsed >= wantedMinutes && allSeen(seen, runRule);
      boolean exhausted = elapsed >= stopMinutes;
      if (rule == runRule && !covered && !exhausted) {
        continue;
      }

      LocalDateTime at = cursor.plusMinutes(elapsed);
      segments.add(segment(runStart, at, runRule));
      if (runRule >= 0) {
        seen.set(runRule);
      }
      if (covered || exhausted) {
        return segments;
      }
      runStart = at;
      runRule = rule;
    }
  }

  private boolean allSeen(BitSet seen, int current) {
    int count = seen.cardinality() + (current >= 0 && !seen.get(current) ? 1 : 0);
    return count == rules.size();
  }

  /** Rule index active in each minute of the given day, -1 for gaps. */
  private int[] slotsFor(LocalDate day) {
    int[] slots = new int[CronPattern.MINUTES_PER_DAY];
    Arrays.fill(slots, -1);
    for (int i = 0; i < rules.size(); i++) {
      ScheduleRule rule = rules.get(i);
      if (!rule.isActiveOn(day)) {
        continue;
      }
      BitSet mask = rule.minuteMask();
      for (int m = mask.nextSetBit(0); m >= 0; m = mask.nextSetBit(m + 1)) {
        slots[m] = i;
      }
    }
    return slots;
  }

  private ScheduleSegment segment(LocalDateTime start, LocalDateTime end, int rule) {
    return new ScheduleSegment(
        start.toInstant(ZoneOffset.UTC),
        end.toInstant(ZoneOffset.UTC),
        rule >= 0 ? rules.get(rule).getPeriodicity() : null);
  }

  private static LocalDateTime toUtcMinute(Instant time) {
    return LocalDateTime.ofInstant(time.truncatedTo(ChronoUnit.MINUTES), ZoneOffset.UTC);
  }

  @Override
  public String spec() {
    return rules.stream().map(ScheduleRule::getSource).collect(Collectors.joining("; "));
  }

  @Override
  public boolean isScheduled() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ScheduledPeriodicity other && spec().equals(other.spec());
  }

  @Override
  public int hashCode() {
    return spec().hashCode();
  }

  @Override
  public String toString() {
    return spec();
  }
}
