package com.acme.brickwatch.scheduler;

import static org.assertj.core.api.Assertions.*;

import com.acme.brickwatch.config.MailConfig;
import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.HistoryEntry;
import com.acme.brickwatch.domain.TransitionKind;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NotificationComposerTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private final NotificationComposer composer = new NotificationComposer(new MailConfig());
  private Brick brick;

  @BeforeEach
  void setup() {
    brick = new Brick();
    brick.setId("abcdefgh");
    brick.setName("Nightly backup");
    brick.setPeriodicity("3600");
    brick.setCreatedAt(T0);
    brick.recordEvent(HistoryEntry.of(T0, "Brick created", null));
    for (int i = 1; i <= 20; i++) {
      brick.recordEvent(HistoryEntry.of(T0.plusSeconds(i * 60L), "Triggered", "run " + i));
    }
    brick.setDeadline(T0.plusSeconds(20 * 60 + 3600));
  }

  @Test
  @DisplayName("late notice should name the missed deadline and list recent events newest first")
  void testLateNotice() {
    // When
    NotificationComposer.Message message = composer.compose(brick, TransitionKind.BECAME_LATE);

    // Then
    assertThat(message.subject()).isEqualTo("[LATE] Nightly backup has not reported");
    assertThat(message.body())
        .contains("The brick Nightly backup (abcdefgh) was expected to report before 2024-01-01T01:20:00Z.")
        .contains("Recent events for this brick:");
    assertThat(message.body().indexOf("Triggered (run 20)"))
        .isLessThan(message.body().indexOf("Triggered (run 19)"));
    assertThat(message.body()).doesNotContain("Triggered (run 5)").doesNotContain("Brick created");
  }

  @Test
  @DisplayName("recovery notice should name the next deadline")
  void testRecoveredNotice() {
    // Given
    brick.setDescription("Runs pg_dump on the primary");

    // When
    NotificationComposer.Message message = composer.compose(brick, TransitionKind.RECOVERED);

    // Then
    assertThat(message.subject()).isEqualTo("[RESUMED] Nightly backup is reporting again");
    assertThat(message.body())
        .contains("is reporting again as of 2024-01-01T00:20:00Z")
        .contains("The next trigger for this brick is due before 2024-01-01T01:20:00Z")
        .contains("Description: Runs pg_dump on the primary");
  }

  @Test
  @DisplayName("recovery notice for a brick in a schedule gap should name the resume time")
  void testRecoveredInGap() {
    // Given
    brick.setDeadline(null);
    brick.setResumeAt(Instant.parse("2024-01-07T00:00:00Z"));

    // When
    String body = composer.compose(brick, TransitionKind.RECOVERED).body();

    // Then
    assertThat(body).contains("No trigger is due until its schedule resumes at 2024-01-07T00:00:00Z");
  }
}
