package com.example.sessionguard.support;

import com.example.sessionguard.adapter.store.DurableSessionStore;
import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.SessionUpdate;
import com.example.sessionguard.exception.SessionPersistenceException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Durable store fake backed by a map. Like the Redis store, an inactive record is never replaced
 * by an upsert. Can be switched into a failing mode to simulate an outage.
 */
public class InMemoryDurableSessionStore implements DurableSessionStore {

  private final Map<String, SessionRecord> records = new ConcurrentHashMap<>();
  private final Clock clock;
  private final AtomicInteger writes = new AtomicInteger();
  private volatile boolean failing;

  public InMemoryDurableSessionStore(Clock clock) {
    this.clock = clock;
  }

  public void setFailing(boolean failing) {
    this.failing = failing;
  }

  /**
   * Puts a record directly, as if another instance had written it.
   */
  public void seed(SessionRecord record) {
    records.put(record.sessionId(), record);
  }

  public Optional<SessionRecord> peek(String sessionId) {
    return Optional.ofNullable(records.get(sessionId));
  }

  public int writeCount() {
    return writes.get();
  }

  @Override
  public void upsert(SessionRecord record) {
    checkAvailable();
    writes.incrementAndGet();
    records.merge(record.sessionId(), record,
                  (current, replacement) -> current.active() ? replacement : current);
  }

  @Override
  public void updateFields(String sessionId, SessionUpdate update) {
    checkAvailable();
    writes.incrementAndGet();
    records.computeIfPresent(sessionId, (id, current) -> update.applyTo(current));
  }

  @Override
  public Optional<SessionRecord> findById(String sessionId) {
    checkAvailable();
    return Optional.ofNullable(records.get(sessionId));
  }

  @Override
  public List<SessionRecord> findActiveByUser(String userId) {
    checkAvailable();
    Instant now = clock.instant();
    return records.values().stream()
        .filter(record -> record.userId().equals(userId))
        .filter(record -> record.isLiveAt(now))
        .toList();
  }

  @Override
  public int bulkDeactivateExpired(Instant before) {
    checkAvailable();
    int count = 0;
    for (SessionRecord record : records.values()) {
      if (record.active() && record.expiresAt().isBefore(before)) {
        records.put(record.sessionId(), record.deactivated());
        count++;
      }
    }
    return count;
  }

  @Override
  public int deactivateAllForUser(String userId, String exceptSessionId, Instant createdBefore) {
    checkAvailable();
    int count = 0;
    for (SessionRecord record : records.values()) {
      if (record.userId().equals(userId)
          && record.active()
          && !record.sessionId().equals(exceptSessionId)
          && record.createdAt().isBefore(createdBefore)) {
        records.put(record.sessionId(), record.deactivated());
        count++;
      }
    }
    return count;
  }

  private void checkAvailable() {
    if (failing) {
      throw new SessionPersistenceException("Durable store unavailable");
    }
  }
}
