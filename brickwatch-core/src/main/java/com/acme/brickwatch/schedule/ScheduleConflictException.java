package com.acme.brickwatch.schedule;

/** Two schedule rules are active during at least one common minute. */
public class ScheduleConflictException extends PeriodicityParseException {

  private final int firstRule;
  private final int secondRule;

  public ScheduleConflictException(ScheduleRule first, ScheduleRule second) {
    super(
        String.format(
            "Schedule rules %d ('%s') and %d ('%s') overlap",
            first.getPosition(), first.getSource(), second.getPosition(), second.getSource()));
    this.firstRule = first.getPosition();
    this.secondRule = second.getPosition();
  }

  /** 1-based position of the earlier conflicting rule. */
  public int getFirstRule() {
    return firstRule;
  }

  /** 1-based position of the later conflicting rule. */
  public int getSecondRule() {
    return secondRule;
  }
}
