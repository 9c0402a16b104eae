package com.example.sessionguard.service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic cleanup of expired and inactive sessions in both storage tiers. A tick that arrives
 * while the previous run is still going is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(value = "app.janitor.enabled", havingValue = "true", matchIfMissing = true)
public class SessionJanitor {

  public record SweepResult(int evictedFromCache, int deactivatedDurably) {
    static final SweepResult SKIPPED = new SweepResult(0, 0);
  }

  private final SessionRecordStore store;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean();

  @Scheduled(fixedRateString = "${app.janitor.interval:PT5M}",
             initialDelayString = "${app.janitor.initial-delay:PT5M}")
  public void scheduledSweep() {
    sweep();
  }

  public SweepResult sweep() {
    if (!running.compareAndSet(false, true)) {
      log.debug("Previous session sweep still running, skipping this tick");
      return SweepResult.SKIPPED;
    }
    try {
      Instant now = clock.instant();
      int evicted = store.sweepExpired(now);
      int deactivated = store.deactivateExpiredDurably(now);
      if (evicted > 0 || deactivated > 0) {
        log.info("Session sweep evicted {} cached and deactivated {} stored session(s)",
                 evicted, deactivated);
      }
      return new SweepResult(evicted, deactivated);
    } catch (RuntimeException e) {
      log.error("Session sweep failed", e);
      return SweepResult.SKIPPED;
    } finally {
      running.set(false);
    }
  }
}
