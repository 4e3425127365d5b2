package com.acme.brickwatch.domain;

import java.time.Instant;

/** One trigger or lifecycle event of a brick. */
public record HistoryEntry(Instant at, String comment) {

  /** Formats {@code "Action"} or {@code "Action (detail)"}. */
  public static HistoryEntry of(Instant at, String action, String detail) {
    if (detail == null || detail.isBlank()) {
      return new HistoryEntry(at, action);
    }
    return new HistoryEntry(at, action + " (" + detail.trim() + ")");
  }
}
