package com.acme.brickwatch.domain;

import com.acme.brickwatch.schedule.DeadlineResult;
import com.acme.brickwatch.schedule.Periodicity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Brick domain entity (pure domain object, no persistence annotations).
 *
 * <p>Scheduling state obeys: {@code deadline} is set only while the brick is unpaused and its
 * schedule is active; {@code late} implies a passed deadline; {@code resumeAt} is set only while an
 * unpaused brick sits in a schedule gap.
 */
@Getter
@Setter
@NoArgsConstructor
public class Brick {

  private Long storeKey;
  private String id;
  private String name;
  private String slug;
  private String description;
  private String periodicity;
  private List<String> emails = new ArrayList<>();
  private boolean paused;
  private boolean late;
  private boolean notifyPending;
  private Instant deadline;
  private Instant resumeAt;
  private String notifyClaimToken;
  private Instant notifyClaimedAt;
  /** Late state the outstanding claim was taken for. */
  private Boolean notifyClaimLate;
  private long version;
  private Instant createdAt;

  /** Oldest first. */
  private List<HistoryEntry> history = new ArrayList<>();

  @Setter(AccessLevel.NONE)
  private final transient List<HistoryEntry> unsavedHistory = new ArrayList<>();

  public Periodicity parsedPeriodicity() {
    return Periodicity.parse(periodicity);
  }

  /** Time of the most recent history event, falling back to the creation time. */
  public Instant lastEventAt() {
    if (history.isEmpty()) {
      return createdAt;
    }
    return history.get(history.size() - 1).at();
  }

  /** Instant at which the scheduler must evaluate this brick, or null if it needs no wake-up. */
  public Instant wakeTarget() {
    if (paused || late) {
      return null;
    }
    return deadline != null ? deadline : resumeAt;
  }

  public List<HistoryEntry> recentHistory(int count) {
    int from = Math.max(0, history.size() - count);
    return Collections.unmodifiableList(history.subList(from, history.size()));
  }

  /** Appends an event and applies the retention policy to the in-memory history. */
  public void recordEvent(HistoryEntry entry) {
    history.add(entry);
    unsavedHistory.add(entry);
    List<Instant> times = history.stream().map(HistoryEntry::at).collect(Collectors.toList());
    int first = HistoryPolicy.firstRetained(times, entry.at());
    if (first > 0) {
      history = new ArrayList<>(history.subList(first, history.size()));
    }
  }

  public void clearUnsavedHistory() {
    unsavedHistory.clear();
  }

  public void applyDeadline(DeadlineResult result) {
    this.deadline = result.deadline();
    this.resumeAt = result.resumeAt();
  }

  // State transitions

  /**
   * Records a trigger: clears late and paused, moves the deadline and owes a recovery notice if
   * the brick was late.
   *
   * @return true if the brick recovered from being late
   */
  public boolean trigger(HistoryEntry event, DeadlineResult next) {
    boolean recovered = late;
    late = false;
    paused = false;
    applyDeadline(next);
    if (recovered) {
      notifyPending = true;
    }
    recordEvent(event);
    return recovered;
  }

  /** Pausing a late brick clears late without any notification. */
  public void pause(HistoryEntry event) {
    if (paused) {
      throw new IllegalStateException("Brick " + id + " is already paused");
    }
    paused = true;
    late = false;
    notifyPending = false;
    deadline = null;
    resumeAt = null;
    recordEvent(event);
  }

  public void unpause(HistoryEntry event, DeadlineResult next) {
    if (!paused) {
      throw new IllegalStateException("Brick " + id + " is already unpaused");
    }
    paused = false;
    late = false;
    applyDeadline(next);
    recordEvent(event);
  }

  /**
   * Applies a deadline recomputed after a periodicity change and re-derives {@code late} from it.
   *
   * @return true if the late state flipped, which owes a notification
   */
  public boolean reevaluate(DeadlineResult next, Instant now) {
    applyDeadline(next);
    boolean nowLate = deadline != null && now.isAfter(deadline);
    if (nowLate == late) {
      return false;
    }
    late = nowLate;
    notifyPending = true;
    return true;
  }

  /**
   * Flips a timely brick whose deadline has passed to late.
   *
   * @return false if the brick is paused, already late or not yet due
   */
  public boolean markLate(Instant now) {
    if (paused || late || deadline == null || deadline.isAfter(now)) {
      return false;
    }
    late = true;
    notifyPending = true;
    return true;
  }

  /**
   * Leaves a schedule gap once the schedule is active again.
   *
   * @return false if the brick is not in a gap or the gap has not ended yet
   */
  public boolean resumeFromGap(Instant now, DeadlineResult next) {
    if (paused || deadline != null || resumeAt == null || resumeAt.isAfter(now)) {
      return false;
    }
    applyDeadline(next);
    return true;
  }
}
