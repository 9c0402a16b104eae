package com.example.sessionguard.service;

import com.example.sessionguard.service.SessionJanitor.SweepResult;
import com.example.sessionguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionJanitor Tests")
class SessionJanitorTest {

  @Mock
  private SessionRecordStore store;

  private MutableClock clock;
  private SessionJanitor janitor;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-05-01T00:00:00Z");
    janitor = new SessionJanitor(store, clock);
  }

  @Test
  @DisplayName("Should sweep the cache and the durable store with the same instant")
  void shouldSweepBothTiers() {
    // Arrange
    Instant now = clock.instant();
    when(store.sweepExpired(now)).thenReturn(3);
    when(store.deactivateExpiredDurably(now)).thenReturn(5);

    // Act
    SweepResult result = janitor.sweep();

    // Assert
    assertThat(result).isEqualTo(new SweepResult(3, 5));
    verify(store).sweepExpired(now);
    verify(store).deactivateExpiredDurably(now);
  }

  @Test
  @DisplayName("Should survive a failing sweep and run again on the next tick")
  void shouldRecoverFromFailure() {
    // Arrange
    when(store.sweepExpired(any())).thenThrow(new IllegalStateException("boom")).thenReturn(1);
    when(store.deactivateExpiredDurably(any())).thenReturn(0);

    // Act
    SweepResult failed = janitor.sweep();
    SweepResult next = janitor.sweep();

    // Assert
    assertThat(failed).isEqualTo(SweepResult.SKIPPED);
    assertThat(next).isEqualTo(new SweepResult(1, 0));
  }

  @Test
  @DisplayName("Should skip a tick while the previous sweep is still running")
  void shouldNotOverlap() throws Exception {
    // Arrange
    CountDownLatch sweeping = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(store.sweepExpired(any())).thenAnswer(invocation -> {
      sweeping.countDown();
      release.await(5, TimeUnit.SECONDS);
      return 2;
    });
    when(store.deactivateExpiredDurably(any())).thenReturn(0);

    // Act
    CompletableFuture<SweepResult> first = CompletableFuture.supplyAsync(janitor::sweep);
    assertThat(sweeping.await(5, TimeUnit.SECONDS)).isTrue();
    SweepResult overlapping = janitor.sweep();
    release.countDown();

    // Assert
    assertThat(overlapping).isEqualTo(SweepResult.SKIPPED);
    assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(new SweepResult(2, 0));
    verify(store, times(1)).sweepExpired(any());
  }
}
