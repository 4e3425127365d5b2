package com.acme.brickwatch.domain;

/** State transitions that produce a notification. */
public enum TransitionKind {
  BECAME_LATE,
  RECOVERED;

  /** Transition whose notification is owed for a brick currently in the given late state. */
  public static TransitionKind forLate(boolean late) {
    return late ? BECAME_LATE : RECOVERED;
  }
}
