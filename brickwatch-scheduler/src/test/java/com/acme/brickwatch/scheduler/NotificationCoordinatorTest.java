package com.acme.brickwatch.scheduler;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.brickwatch.config.MailConfig;
import com.acme.brickwatch.config.SchedulerConfig;
import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.HistoryEntry;
import com.acme.brickwatch.domain.TransitionKind;
import com.acme.brickwatch.schedule.DeadlineCalculator;
import com.acme.brickwatch.spi.MailSender;
import com.acme.brickwatch.spi.NotificationSendException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationCoordinator Tests")
class NotificationCoordinatorTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  @Mock private MailSender mailSender;

  private InMemoryBrickRepository repository;
  private MutableClock clock;
  private NotificationCoordinator coordinator;

  @BeforeEach
  void setup() {
    repository = new InMemoryBrickRepository();
    clock = new MutableClock(T0.plusSeconds(3601));
    coordinator =
        new NotificationCoordinator(
            repository,
            mailSender,
            new NotificationComposer(new MailConfig()),
            new SchedulerConfig(),
            clock);
  }

  @AfterEach
  void tearDown() {
    coordinator.close();
  }

  private Brick lateBrick(String id, List<String> emails) {
    Brick brick = new Brick();
    brick.setId(id);
    brick.setName("Nightly backup");
    brick.setSlug("nightly-backup");
    brick.setPeriodicity("3600");
    brick.setEmails(new ArrayList<>(emails));
    brick.setCreatedAt(T0);
    brick.recordEvent(HistoryEntry.of(T0, "Brick created", null));
    brick.setDeadline(T0.plusSeconds(3600));
    brick.markLate(T0.plusSeconds(3601));
    repository.put(brick);
    return brick;
  }

  private void pauseStored(String id) {
    Brick brick = repository.findById(id).orElseThrow();
    brick.pause(HistoryEntry.of(T0.plusSeconds(3650), "Paused", null));
    assertThat(repository.update(brick, brick.getVersion())).isTrue();
  }

  @Nested
  @DisplayName("Claiming")
  class ClaimTests {

    @Test
    @DisplayName("concurrent notifiers should send the late notice exactly once")
    void testConcurrentClaims() throws Exception {
      // Given
      lateBrick("aaaaaaaa", List.of("ops@example.com"));
      int threads = 8;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<Boolean>> results = new ArrayList<>();

      // When
      try {
        for (int i = 0; i < threads; i++) {
          Callable<Boolean> task =
              () -> {
                start.await();
                return coordinator.notify("aaaaaaaa", TransitionKind.BECAME_LATE);
              };
          results.add(pool.submit(task));
        }
        start.countDown();
        int delivered = 0;
        for (Future<Boolean> result : results) {
          if (result.get(10, TimeUnit.SECONDS)) {
            delivered++;
          }
        }

        // Then
        assertThat(delivered).isEqualTo(1);
        assertThat(repository.claimAttempts.get()).isEqualTo(threads);
        verify(mailSender, times(1))
            .send(eq(List.of("ops@example.com")), startsWith("[LATE] Nightly backup"), anyString());
        Brick stored = repository.stored("aaaaaaaa");
        assertThat(stored.isNotifyPending()).isFalse();
        assertThat(stored.getNotifyClaimToken()).isNull();
      } finally {
        pool.shutdownNow();
      }
    }

    @Test
    @DisplayName("a notice for a transition that was reversed should not be sent")
    void testSupersededTransition() {
      // Given: the brick became late and recovered before the late notice went out
      Brick brick = lateBrick("aaaaaaaa", List.of("ops@example.com"));
      brick.trigger(
          HistoryEntry.of(T0.plusSeconds(3700), "Triggered", null),
          new DeadlineCalculator()
              .nextDeadline(T0.plusSeconds(3700), brick.parsedPeriodicity(), false));
      repository.update(brick, brick.getVersion());

      // When
      boolean lateSent = coordinator.notify("aaaaaaaa", TransitionKind.BECAME_LATE);
      boolean recoveredSent = coordinator.notify("aaaaaaaa", TransitionKind.RECOVERED);

      // Then
      assertThat(lateSent).isFalse();
      assertThat(recoveredSent).isTrue();
      verify(mailSender).send(anyList(), startsWith("[RESUMED]"), anyString());
      verifyNoMoreInteractions(mailSender);
    }

    @Test
    @DisplayName("a brick without recipients should complete its notice without sending")
    void testNoRecipients() {
      // Given
      lateBrick("aaaaaaaa", List.of());

      // When
      boolean done = coordinator.notify("aaaaaaaa", TransitionKind.BECAME_LATE);

      // Then
      assertThat(done).isTrue();
      verifyNoInteractions(mailSender);
      assertThat(repository.stored("aaaaaaaa").isNotifyPending()).isFalse();
      assertThat(repository.stored("aaaaaaaa").getNotifyClaimToken()).isNull();
    }

    @Test
    @DisplayName("a deleted brick should not be notified")
    void testDeletedBrick() {
      assertThat(coordinator.notify("missing0", TransitionKind.BECAME_LATE)).isFalse();
      verifyNoInteractions(mailSender);
    }
  }

  @Nested
  @DisplayName("Retry")
  class RetryTests {

    @Test
    @DisplayName("a failed send should release the claim so the next retry delivers it")
    void testSendFailureRetried() {
      // Given
      lateBrick("aaaaaaaa", List.of("ops@example.com"));
      doThrow(new NotificationSendException("relay down"))
          .doNothing()
          .when(mailSender)
          .send(anyList(), anyString(), anyString());

      // When
      boolean first = coordinator.notify("aaaaaaaa", TransitionKind.BECAME_LATE);

      // Then
      assertThat(first).isFalse();
      assertThat(repository.stored("aaaaaaaa").isNotifyPending()).isTrue();
      assertThat(repository.stored("aaaaaaaa").getNotifyClaimToken()).isNull();

      // When
      int sent = coordinator.retryPending();

      // Then
      assertThat(sent).isEqualTo(1);
      assertThat(repository.stored("aaaaaaaa").isNotifyPending()).isFalse();
      verify(mailSender, times(2)).send(anyList(), startsWith("[LATE]"), anyString());
    }

    @Test
    @DisplayName("a claim abandoned by a crashed process should be delivered after recovery")
    void testStaleClaimRecovered() {
      // Given
      lateBrick("aaaaaaaa", List.of("ops@example.com"));
      repository.claimNotification("aaaaaaaa", true, "crashed", T0.plusSeconds(3601));
      assertThat(coordinator.retryPending()).isZero();

      // When
      repository.recoverStaleClaims(T0.plusSeconds(4000));
      int sent = coordinator.retryPending();

      // Then
      assertThat(sent).isEqualTo(1);
      verify(mailSender).send(anyList(), startsWith("[LATE]"), anyString());
    }

    @Test
    @DisplayName("a pause while the late notice is being sent should leave nothing owed when the send fails")
    void testPauseDuringFailedSend() {
      // Given
      lateBrick("aaaaaaaa", List.of("ops@example.com"));
      doAnswer(
              invocation -> {
                pauseStored("aaaaaaaa");
                throw new NotificationSendException("relay down");
              })
          .when(mailSender)
          .send(anyList(), anyString(), anyString());

      // When
      boolean sent = coordinator.notify("aaaaaaaa", TransitionKind.BECAME_LATE);

      // Then
      assertThat(sent).isFalse();
      Brick stored = repository.stored("aaaaaaaa");
      assertThat(stored.isPaused()).isTrue();
      assertThat(stored.isNotifyPending()).isFalse();
      assertThat(stored.getNotifyClaimToken()).isNull();

      // When
      int retried = coordinator.retryPending();

      // Then
      assertThat(retried).isZero();
      verify(mailSender, never()).send(anyList(), startsWith("[RESUMED]"), anyString());
    }

    @Test
    @DisplayName("recovering a crashed claim on a brick paused since should not owe a notice")
    void testStaleClaimOnPausedBrick() {
      // Given
      lateBrick("aaaaaaaa", List.of("ops@example.com"));
      repository.claimNotification("aaaaaaaa", true, "crashed", T0.plusSeconds(3601));
      pauseStored("aaaaaaaa");

      // When
      int recovered = repository.recoverStaleClaims(T0.plusSeconds(4000));
      int sent = coordinator.retryPending();

      // Then
      assertThat(recovered).isEqualTo(1);
      assertThat(sent).isZero();
      assertThat(repository.stored("aaaaaaaa").isNotifyPending()).isFalse();
      verifyNoInteractions(mailSender);
    }
  }

  @Test
  @DisplayName("dispatch should deliver on the notification executor")
  void testDispatch() {
    // Given
    lateBrick("aaaaaaaa", List.of("ops@example.com"));

    // When
    coordinator.dispatch("aaaaaaaa", TransitionKind.BECAME_LATE);

    // Then
    verify(mailSender, timeout(5000)).send(anyList(), startsWith("[LATE]"), anyString());
  }
}
