package com.example.sessionguard.adapter.store;

import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.SessionUpdate;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable tier behind the in-process session cache.
 * Implementations may block on I/O; the session service only calls them from the write-behind
 * executor, on a cache miss, or from the janitor.
 */
public interface DurableSessionStore {

  /**
   * Inserts or replaces the record. A stored inactive record is never replaced: once a session is
   * deactivated here it stays deactivated whatever order the writes arrive in.
   */
  void upsert(SessionRecord record);

  /**
   * Applies a partial update to a stored record. Unknown ids are ignored. Implementations must not
   * let an update computed from a stale copy overwrite a newer one.
   */
  void updateFields(String sessionId, SessionUpdate update);

  Optional<SessionRecord> findById(String sessionId);

  /**
   * Active, unexpired records of one user.
   */
  List<SessionRecord> findActiveByUser(String userId);

  /**
   * Deactivates every record whose {@code expiresAt} is before the given instant.
   *
   * @return the number of records deactivated
   */
  int bulkDeactivateExpired(Instant before);

  /**
   * Deactivates every record of the user created before {@code createdBefore}, except
   * {@code exceptSessionId}, which may be null.
   *
   * @return the number of records deactivated
   */
  int deactivateAllForUser(String userId, String exceptSessionId, Instant createdBefore);
}
