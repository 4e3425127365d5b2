package com.acme.brickwatch.scheduler;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.brickwatch.config.SchedulerConfig;
import com.acme.brickwatch.core.TransientException;
import com.acme.brickwatch.repository.BrickRepository;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationSweeperTest {

  private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

  @Mock private BrickRepository repository;
  @Mock private NotificationCoordinator coordinator;

  private NotificationSweeper sweeper;

  @BeforeEach
  void setup() {
    sweeper = new NotificationSweeper(repository, coordinator, new SchedulerConfig(), new MutableClock(NOW));
  }

  @Test
  @DisplayName("tick should recover claims older than the claim timeout and then retry pending notices")
  void testTick() {
    // Given
    when(repository.recoverStaleClaims(any())).thenReturn(2);
    when(coordinator.retryPending()).thenReturn(2);

    // When
    sweeper.tick();

    // Then
    var order = inOrder(repository, coordinator);
    order.verify(repository).recoverStaleClaims(NOW.minusSeconds(300));
    order.verify(coordinator).retryPending();
  }

  @Test
  @DisplayName("tick should survive a store failure")
  void testTickFailure() {
    // Given
    when(repository.recoverStaleClaims(any())).thenThrow(new TransientException("store down"));

    // When
    sweeper.tick();

    // Then
    verify(coordinator, never()).retryPending();
  }
}
