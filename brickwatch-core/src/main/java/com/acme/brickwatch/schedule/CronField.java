package com.acme.brickwatch.schedule;

import java.util.BitSet;
import java.util.List;
import java.util.Locale;

/**
 * One field of a five-field cron expression: exact values, ranges, lists, wildcards and steps,
 * with optional symbolic names (month and weekday abbreviations).
 */
final class CronField {

  static final List<String> MONTH_NAMES =
      List.of("jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");
  static final List<String> WEEKDAY_NAMES = List.of("sun", "mon", "tue", "wed", "thu", "fri", "sat");

  private final String label;
  private final BitSet values;
  private final boolean wildcard;

  private CronField(String label, BitSet values, boolean wildcard) {
    this.label = label;
    this.values = values;
    this.wildcard = wildcard;
  }

  static CronField minutes(String expr) {
    return parse("minute", expr, 0, 59, List.of(), 0);
  }

  static CronField hours(String expr) {
    return parse("hour", expr, 0, 23, List.of(), 0);
  }

  static CronField daysOfMonth(String expr) {
    return parse("day-of-month", expr, 1, 31, List.of(), 0);
  }

  static CronField months(String expr) {
    return parse("month", expr, 1, 12, MONTH_NAMES, 1);
  }

  /** Weekdays 0-7 where both 0 and 7 are Sunday. */
  static CronField daysOfWeek(String expr) {
    CronField raw = parse("day-of-week", expr, 0, 7, WEEKDAY_NAMES, 0);
    if (raw.values.get(7)) {
      raw.values.clear(7);
      raw.values.set(0);
    }
    return raw;
  }

  private static CronField parse(
      String label, String expr, int min, int max, List<String> names, int nameOffset) {
    if (expr == null || expr.isEmpty()) {
      throw new PeriodicityParseException("Empty " + label + " field");
    }
    BitSet values = new BitSet(max + 1);
    for (String part : expr.split(",", -1)) {
      parsePart(label, expr, part.toLowerCase(Locale.ROOT), min, max, names, nameOffset, values);
    }
    return new CronField(label, values, expr.startsWith("*"));
  }

  private static void parsePart(
      String label,
      String expr,
      String part,
      int min,
      int max,
      List<String> names,
      int nameOffset,
      BitSet values) {
    if (part.isEmpty()) {
      throw new PeriodicityParseException("Empty list element in " + label + " field '" + expr + "'");
    }

    int step = 1;
    String range = part;
    int slash = part.indexOf('/');
    if (slash >= 0) {
      range = part.substring(0, slash);
      step = parseNumber(label, expr, part.substring(slash + 1), 1, Integer.MAX_VALUE);
    }

    int from;
    int to;
    if (range.equals("*")) {
      from = min;
      to = max;
    } else {
      int dash = range.indexOf('-');
      if (dash > 0) {
        from = parseValue(label, expr, range.substring(0, dash), min, max, names, nameOffset);
        to = parseValue(label, expr, range.substring(dash + 1), min, max, names, nameOffset);
        if (to < from) {
          throw new PeriodicityParseException(
              "Descending range '" + range + "' in " + label + " field '" + expr + "'");
        }
      } else {
        from = parseValue(label, expr, range, min, max, names, nameOffset);
        // "5/15" means every 15 starting at 5
        to = slash >= 0 ? max : from;
      }
    }

    for (int v = from; v <= to; v += step) {
      values.set(v);
    }
  }

  private static int parseValue(
      String label, String expr, String token, int min, int max, List<String> names, int offset) {
    int named = names.indexOf(token);
    if (named >= 0) {
      return named + offset;
    }
    return parseNumber(label, expr, token, min, max);
  }

  private static int parseNumber(String label, String expr, String token, int min, int max) {
    int value;
    try {
      value = Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new PeriodicityParseException(
          "Invalid value '" + token + "' in " + label + " field '" + expr + "'", e);
    }
    if (value < min || value > max) {
      throw new PeriodicityParseException(
          "Value " + value + " out of range " + min + "-" + max + " in " + label + " field '" + expr + "'");
    }
    return value;
  }

  boolean matches(int value) {
    return values.get(value);
  }

  /** True when the field was written starting with '*', which matters for day matching. */
  boolean isWildcard() {
    return wildcard;
  }

  BitSet values() {
    return (BitSet) values.clone();
  }

  @Override
  public String toString() {
    return label + values;
  }
}
