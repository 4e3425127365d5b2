package com.acme.brickwatch.domain;

import static org.assertj.core.api.Assertions.*;

import com.acme.brickwatch.schedule.DeadlineCalculator;
import com.acme.brickwatch.schedule.DeadlineResult;
import com.acme.brickwatch.schedule.Periodicity;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for brick state transitions */
class BrickTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private final DeadlineCalculator calculator = new DeadlineCalculator();
  private Brick brick;

  @BeforeEach
  void setUp() {
    brick = new Brick();
    brick.setId("abcdefgh");
    brick.setName("Nightly");
    brick.setPeriodicity("3600");
    brick.setCreatedAt(T0);
    brick.recordEvent(HistoryEntry.of(T0, "Brick created", null));
    brick.applyDeadline(next(T0));
    brick.clearUnsavedHistory();
  }

  private DeadlineResult next(Instant at) {
    return calculator.nextDeadline(at, brick.parsedPeriodicity(), brick.isPaused());
  }

  private DeadlineResult nextUnpaused(Instant at) {
    return calculator.nextDeadline(at, brick.parsedPeriodicity(), false);
  }

  @Nested
  @DisplayName("Trigger")
  class TriggerTests {

    @Test
    @DisplayName("triggering a timely brick twice should never owe a notification")
    void testTriggerTimelyTwice() {
      // When
      boolean first = brick.trigger(HistoryEntry.of(T0.plusSeconds(10), "Triggered", null), next(T0.plusSeconds(10)));
      boolean second = brick.trigger(HistoryEntry.of(T0.plusSeconds(20), "Triggered", null), next(T0.plusSeconds(20)));

      // Then
      assertThat(first).isFalse();
      assertThat(second).isFalse();
      assertThat(brick.isNotifyPending()).isFalse();
      assertThat(brick.getDeadline()).isEqualTo(T0.plusSeconds(3620));
      assertThat(brick.getUnsavedHistory()).hasSize(2);
    }

    @Test
    @DisplayName("triggering a late brick should recover it exactly once")
    void testTriggerLate() {
      // Given
      assertThat(brick.markLate(T0.plusSeconds(3601))).isTrue();

      // When
      boolean recovered = brick.trigger(HistoryEntry.of(T0.plusSeconds(3700), "Triggered", null), next(T0.plusSeconds(3700)));
      boolean again = brick.trigger(HistoryEntry.of(T0.plusSeconds(3710), "Triggered", null), next(T0.plusSeconds(3710)));

      // Then
      assertThat(recovered).isTrue();
      assertThat(again).isFalse();
      assertThat(brick.isLate()).isFalse();
      assertThat(brick.isNotifyPending()).isTrue();
    }

    @Test
    @DisplayName("triggering a paused brick should unpause it")
    void testTriggerPaused() {
      // Given
      brick.pause(HistoryEntry.of(T0.plusSeconds(5), "Paused", null));

      // When
      brick.trigger(HistoryEntry.of(T0.plusSeconds(50), "Triggered", "ok"), nextUnpaused(T0.plusSeconds(50)));

      // Then
      assertThat(brick.isPaused()).isFalse();
      assertThat(brick.getDeadline()).isEqualTo(T0.plusSeconds(3650));
      assertThat(brick.lastEventAt()).isEqualTo(T0.plusSeconds(50));
      assertThat(brick.getHistory().get(brick.getHistory().size() - 1).comment()).isEqualTo("Triggered (ok)");
    }
  }

  @Nested
  @DisplayName("Late detection")
  class LateTests {

    @Test
    @DisplayName("a brick should not be late before its deadline")
    void testNotYetDue() {
      assertThat(brick.markLate(T0.plusSeconds(3599))).isFalse();
      assertThat(brick.markLate(T0.plusSeconds(3600))).isTrue();
      assertThat(brick.isLate()).isTrue();
      assertThat(brick.isNotifyPending()).isTrue();
      assertThat(brick.wakeTarget()).isNull();
    }

    @Test
    @DisplayName("a late brick should not be marked late again")
    void testAlreadyLate() {
      brick.markLate(T0.plusSeconds(3601));

      assertThat(brick.markLate(T0.plusSeconds(4000))).isFalse();
      assertThat(brick.getDeadline()).isEqualTo(T0.plusSeconds(3600));
    }
  }

  @Nested
  @DisplayName("Pause and unpause")
  class PauseTests {

    @Test
    @DisplayName("pausing should clear deadline and late without owing a notification")
    void testPauseWhileLate() {
      // Given
      brick.markLate(T0.plusSeconds(3601));

      // When
      brick.pause(HistoryEntry.of(T0.plusSeconds(3602), "Paused", "maintenance"));

      // Then
      assertThat(brick.isPaused()).isTrue();
      assertThat(brick.isLate()).isFalse();
      assertThat(brick.isNotifyPending()).isFalse();
      assertThat(brick.getDeadline()).isNull();
      assertThat(brick.wakeTarget()).isNull();
    }

    @Test
    @DisplayName("pause then unpause should restart the deadline from the unpause time")
    void testPauseUnpause() {
      // When
      brick.pause(HistoryEntry.of(T0.plusSeconds(100), "Paused", null));
      Instant unpauseAt = T0.plusSeconds(9000);
      brick.unpause(HistoryEntry.of(unpauseAt, "Unpaused", null), nextUnpaused(unpauseAt));

      // Then
      assertThat(brick.getDeadline()).isEqualTo(unpauseAt.plusSeconds(3600));
      assertThat(brick.isLate()).isFalse();
      assertThat(brick.isPaused()).isFalse();
    }

    @Test
    @DisplayName("pausing twice or unpausing an active brick should fail")
    void testAlreadyInState() {
      assertThatThrownBy(() -> brick.unpause(HistoryEntry.of(T0, "Unpaused", null), next(T0)))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("already unpaused");

      brick.pause(HistoryEntry.of(T0, "Paused", null));

      assertThatThrownBy(() -> brick.pause(HistoryEntry.of(T0, "Paused", null)))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("already paused");
    }
  }

  @Nested
  @DisplayName("Periodicity change and schedule gaps")
  class ReevaluationTests {

    @Test
    @DisplayName("shortening the periodicity should flip a timely brick to late")
    void testReevaluateToLate() {
      // Given
      brick.setPeriodicity("60");

      // When
      boolean flipped = brick.reevaluate(nextUnpaused(brick.lastEventAt()), T0.plusSeconds(120));

      // Then
      assertThat(flipped).isTrue();
      assertThat(brick.isLate()).isTrue();
      assertThat(brick.isNotifyPending()).isTrue();
      assertThat(brick.getDeadline()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    @DisplayName("lengthening the periodicity should recover a late brick")
    void testReevaluateToTimely() {
      // Given
      brick.markLate(T0.plusSeconds(3700));
      brick.setNotifyPending(false);
      brick.setPeriodicity("86400");

      // When
      boolean flipped = brick.reevaluate(nextUnpaused(brick.lastEventAt()), T0.plusSeconds(3800));

      // Then
      assertThat(flipped).isTrue();
      assertThat(brick.isLate()).isFalse();
      assertThat(brick.isNotifyPending()).isTrue();
    }

    @Test
    @DisplayName("a brick in a gap should resume once the schedule is active again")
    void testResumeFromGap() {
      // Given: Saturday trigger with a schedule that skips Saturday
      brick.setPeriodicity("* * * * sun 300; * * * * mon-fri 600");
      Instant saturday = Instant.parse("2024-01-06T10:00:00Z");
      brick.trigger(HistoryEntry.of(saturday, "Triggered", null), next(saturday));
      assertThat(brick.getDeadline()).isNull();
      assertThat(brick.wakeTarget()).isEqualTo(Instant.parse("2024-01-07T00:00:00Z"));

      // When
      Instant sunday = brick.getResumeAt();
      boolean early = brick.resumeFromGap(sunday.minusSeconds(1), next(sunday));
      boolean resumed = brick.resumeFromGap(sunday, next(sunday));

      // Then
      assertThat(early).isFalse();
      assertThat(resumed).isTrue();
      assertThat(brick.getDeadline()).isEqualTo(sunday.plusSeconds(300));
      assertThat(brick.getResumeAt()).isNull();
    }
  }

  @Test
  @DisplayName("history length should stay within the retention bound after many triggers")
  void testHistoryPruning() {
    Instant at = T0;
    for (int i = 0; i < 2000; i++) {
      at = at.plus(Duration.ofMinutes(30));
      brick.trigger(HistoryEntry.of(at, "Triggered", null), next(at));

      Instant boundary = at.minus(HistoryPolicy.RETENTION);
      List<HistoryEntry> history = brick.getHistory();
      long recent = history.stream().filter(e -> !e.at().isBefore(boundary)).count();
      assertThat(history.size()).isLessThanOrEqualTo((int) Math.max(HistoryPolicy.MIN_ENTRIES, recent));
    }
    // 30 minute spacing: 7 days hold 337 events
    assertThat(brick.getHistory()).hasSize(337);
  }

  @Test
  @DisplayName("recent history should return the newest events")
  void testRecentHistory() {
    for (int i = 1; i <= 20; i++) {
      brick.recordEvent(HistoryEntry.of(T0.plusSeconds(i), "Triggered", Integer.toString(i)));
    }

    List<HistoryEntry> recent = brick.recentHistory(15);

    assertThat(recent).hasSize(15);
    assertThat(recent.get(14).comment()).isEqualTo("Triggered (20)");
  }
}
