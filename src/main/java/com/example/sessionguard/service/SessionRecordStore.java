package com.example.sessionguard.service;

import com.example.sessionguard.adapter.store.DurableSessionStore;
import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.SessionUpdate;
import com.example.sessionguard.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import static com.example.sessionguard.util.LogMasking.maskSessionId;

/**
 * Two-tier session storage: an authoritative in-process Caffeine cache in front of a
 * {@link DurableSessionStore}.
 * <p>
 * Writes land in the cache synchronously and reach the durable tier on the write-behind executor;
 * failures there are logged and never surfaced. Durable writes for one session id run one at a
 * time in submission order, so a deactivation can never be overtaken by an earlier upsert. Reads are cache-first with a single read-through
 * on a miss. The durable tier may lag the cache by the write-behind queue latency. Recently
 * terminated ids are remembered for a while so a lagging durable copy cannot bring them back.
 */
@Slf4j
@Service
public class SessionRecordStore {

  static final Duration TOMBSTONE_TTL = Duration.ofMinutes(10);

  private final DurableSessionStore durableStore;
  private final Executor writeBehindExecutor;
  private final Clock clock;
  private final Cache<String, SessionRecord> cache;
  private final Cache<String, Instant> tombstones;
  private final ConcurrentMap<String, CompletableFuture<Void>> pendingWrites = new ConcurrentHashMap<>();

  public SessionRecordStore(
      DurableSessionStore durableStore,
      @Qualifier("sessionWriteBehindExecutor") Executor writeBehindExecutor,
      ApplicationProperties properties,
      Clock clock) {
    this.durableStore = durableStore;
    this.writeBehindExecutor = writeBehindExecutor;
    this.clock = clock;

    this.cache = Caffeine.newBuilder()
        .maximumSize(properties.cache().session().maxSize())
        .recordStats()
        .build();
    this.tombstones = Caffeine.newBuilder()
        .expireAfterWrite(TOMBSTONE_TTL)
        .build();
  }

  public void create(SessionRecord record) {
    cache.put(record.sessionId(), record);
    dispatch(record.sessionId(), "upsert", () -> durableStore.upsert(record));
  }

  /**
   * Cache-first lookup with one durable read-through on a miss. Only active records are re-cached.
   */
  public Optional<SessionRecord> get(String sessionId) {
    SessionRecord cached = cache.getIfPresent(sessionId);
    if (cached != null) {
      return Optional.of(cached);
    }
    if (tombstones.getIfPresent(sessionId) != null) {
      return Optional.empty();
    }

    Optional<SessionRecord> durable;
    try {
      durable = durableStore.findById(sessionId);
    } catch (RuntimeException e) {
      log.warn("Durable read-through failed for session {}", maskSessionId(sessionId), e);
      return Optional.empty();
    }

    if (durable.isEmpty()) {
      return Optional.empty();
    }
    SessionRecord record = durable.get();
    if (!record.active()) {
      return Optional.of(record);
    }
    log.debug("Session {} loaded from durable store", maskSessionId(sessionId));
    SessionRecord winner = cache.asMap().putIfAbsent(sessionId, record);
    return Optional.of(winner != null ? winner : record);
  }

  /**
   * Applies the update to the cached record, if any, and propagates it to the durable tier.
   *
   * @return the updated cached record
   */
  public Optional<SessionRecord> updateFields(String sessionId, SessionUpdate update) {
    SessionRecord updated = cache.asMap()
        .computeIfPresent(sessionId, (id, current) -> update.applyTo(current));
    dispatch(sessionId, "update", () -> durableStore.updateFields(sessionId, update));
    return Optional.ofNullable(updated);
  }

  /**
   * Deactivates the session in both tiers. Idempotent.
   *
   * @return the record, if this call is the one that deactivated the cached copy
   */
  public Optional<SessionRecord> markInactive(String sessionId) {
    AtomicReference<SessionRecord> deactivated = new AtomicReference<>();
    SessionRecord inactive = cache.asMap().computeIfPresent(sessionId, (id, current) -> {
      if (current.active()) {
        deactivated.set(current.deactivated());
        return deactivated.get();
      }
      return current;
    });
    tombstones.put(sessionId, clock.instant());
    if (inactive != null) {
      // the full inactive record, so the durable copy ends inactive even if its upsert was dropped
      dispatch(sessionId, "deactivation", () -> durableStore.upsert(inactive));
    } else {
      dispatch(sessionId, "deactivation",
               () -> durableStore.updateFields(sessionId, SessionUpdate.deactivation()));
    }
    return Optional.ofNullable(deactivated.get());
  }

  /**
   * Removes a record from the cache tier only.
   */
  public void evict(String sessionId) {
    cache.invalidate(sessionId);
  }

  /**
   * Active, unexpired sessions of a user from both tiers, de-duplicated by id. The cached copy
   * wins on conflict. A durable failure degrades to the cached set.
   */
  public List<SessionRecord> listActiveByUser(String userId) {
    Instant now = clock.instant();
    Map<String, SessionRecord> merged = new LinkedHashMap<>();
    for (SessionRecord record : listCachedActiveByUser(userId)) {
      merged.put(record.sessionId(), record);
    }

    List<SessionRecord> durable;
    try {
      durable = durableStore.findActiveByUser(userId);
    } catch (RuntimeException e) {
      log.warn("Durable lookup of sessions failed for user {}; using cached sessions only", userId, e);
      return new ArrayList<>(merged.values());
    }

    for (SessionRecord record : durable) {
      String sessionId = record.sessionId();
      if (merged.containsKey(sessionId)
          || cache.getIfPresent(sessionId) != null
          || tombstones.getIfPresent(sessionId) != null
          || !record.isLiveAt(now)) {
        continue;
      }
      merged.put(sessionId, record);
    }
    return new ArrayList<>(merged.values());
  }

  public List<SessionRecord> listCachedActiveByUser(String userId) {
    Instant now = clock.instant();
    return cache.asMap().values().stream()
        .filter(record -> record.userId().equals(userId))
        .filter(record -> record.isLiveAt(now))
        .toList();
  }

  public Collection<SessionRecord> cachedRecords() {
    return List.copyOf(cache.asMap().values());
  }

  /**
   * Queues a durable deactivation of every session of the user created before now, except
   * {@code exceptSessionId}. Sessions created after this call are left alone even if the queued
   * write runs later.
   */
  public void deactivateAllForUser(String userId, String exceptSessionId) {
    Instant cutoff = clock.instant();
    submit("bulk deactivation for user " + userId, () -> {
      int count = durableStore.deactivateAllForUser(userId, exceptSessionId, cutoff);
      log.debug("Deactivated {} durable session(s) for user {}", count, userId);
    });
  }

  /**
   * Evicts cached records that are expired or inactive.
   *
   * @return the number of records evicted
   */
  public int sweepExpired(Instant now) {
    int evicted = 0;
    for (Map.Entry<String, SessionRecord> entry : cache.asMap().entrySet()) {
      SessionRecord record = entry.getValue();
      if ((record.isExpiredAt(now) || !record.active())
          && cache.asMap().remove(entry.getKey(), record)) {
        evicted++;
      }
    }
    return evicted;
  }

  /**
   * Bulk durable deactivation of expired records. Runs on the caller's thread.
   *
   * @return the number of records deactivated, 0 when the durable store failed
   */
  public int deactivateExpiredDurably(Instant now) {
    try {
      return durableStore.bulkDeactivateExpired(now);
    } catch (RuntimeException e) {
      log.error("Bulk deactivation of expired sessions failed", e);
      return 0;
    }
  }

  @PreDestroy
  public void shutdown() {
    log.info("Shutting down session store, dropping {} cached session(s). Cache stats: {}",
             cache.estimatedSize(), cache.stats());
    cache.invalidateAll();
    tombstones.invalidateAll();
  }

  /**
   * Chains the write behind any durable write still pending for the same session.
   */
  private void dispatch(String sessionId, String operation, Runnable write) {
    String description = operation + " of session " + maskSessionId(sessionId);
    CompletableFuture<Void> tail = pendingWrites.compute(sessionId, (id, previous) -> previous == null
        ? submit(description, write)
        : previous.thenCompose(ignored -> submit(description, write)));
    tail.whenComplete((ignored, error) -> pendingWrites.remove(sessionId, tail));
  }

  /**
   * Runs the write on the write-behind executor. The returned future always completes normally.
   */
  private CompletableFuture<Void> submit(String description, Runnable write) {
    try {
      return CompletableFuture.runAsync(write, writeBehindExecutor)
          .handle((ignored, error) -> {
            if (error != null) {
              Throwable cause = error.getCause() != null ? error.getCause() : error;
              log.warn("Durable {} failed", description, cause);
            }
            return null;
          });
    } catch (RejectedExecutionException e) {
      log.warn("Write-behind queue full, dropped durable {}", description, e);
      return CompletableFuture.completedFuture(null);
    }
  }
}
