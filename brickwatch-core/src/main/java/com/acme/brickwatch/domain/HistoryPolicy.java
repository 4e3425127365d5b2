package com.acme.brickwatch.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Retention rule for brick history: keep the larger of the newest {@value #MIN_ENTRIES} entries
 * and every entry from the last seven days, but never more than {@value #MAX_ENTRIES}.
 */
public final class HistoryPolicy {

  public static final int MIN_ENTRIES = 100;
  public static final int MAX_ENTRIES = 1000;
  public static final Duration RETENTION = Duration.ofDays(7);

  private HistoryPolicy() {}

  /**
   * Index of the oldest entry to keep in an oldest-first history; every entry before it is to be
   * dropped.
   */
  public static int firstRetained(List<Instant> ascending, Instant now) {
    Instant boundary = now.minus(RETENTION);
    int size = ascending.size();
    int first = 0;
    while (size - first > MAX_ENTRIES
        || (size - first > MIN_ENTRIES && ascending.get(first).isBefore(boundary))) {
      first++;
    }
    return first;
  }
}
