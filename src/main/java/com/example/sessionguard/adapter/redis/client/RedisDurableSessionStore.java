package com.example.sessionguard.adapter.redis.client;

import com.example.sessionguard.adapter.store.DurableSessionStore;
import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.SessionUpdate;
import com.example.sessionguard.exception.SessionPersistenceException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import static com.example.sessionguard.util.LogMasking.maskSessionId;

/**
 * Redis-backed durable session store.
 * <p>
 * Layout: one JSON value per session ({@code session:<id>}), a per-user index set
 * ({@code user_sessions:<userId>}) and a sorted set of active session ids scored by expiry
 * ({@code session_expiry}). Deactivated records are kept for the configured retention so a
 * read-through can never bring them back as active.
 * <p>
 * The record value is authoritative and the indexes are hints. Every value write goes through
 * {@link #WRITE_SCRIPT}, which never replaces an inactive record with an active one; updates
 * compare-and-set against the value they were computed from.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisDurableSessionStore implements DurableSessionStore {

  public static final String SESSION_KEY_PREFIX = "session:";
  public static final String USER_SESSIONS_INDEX_PREFIX = "user_sessions:";
  public static final String EXPIRY_INDEX_KEY = "session_expiry";
  private static final Duration MIN_TTL = Duration.ofSeconds(1);
  private static final int MAX_UPDATE_ATTEMPTS = 5;

  static final long WRITTEN = 1L;
  static final long KEPT_INACTIVE = 0L;
  static final long CONFLICT = -1L;

  /**
   * KEYS[1] session key. ARGV[1] new value, ARGV[2] TTL in millis, ARGV[3] the value an update was
   * computed from, or empty for an upsert.
   */
  static final RedisScript<Long> WRITE_SCRIPT = new DefaultRedisScript<>(
      "local current = redis.call('GET', KEYS[1]) "
          + "if ARGV[3] ~= '' then "
          + "  if current ~= ARGV[3] then return -1 end "
          + "elseif current and cjson.decode(current)['active'] == false then "
          + "  return 0 "
          + "end "
          + "redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2]) "
          + "return 1",
      Long.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;
  private final Clock clock;

  @Override
  @CircuitBreaker(name = "sessionStore")
  public void upsert(SessionRecord record) {
    if (write(record, "") == KEPT_INACTIVE) {
      log.debug("Session {} is already inactive in Redis, upsert ignored", maskSessionId(record.sessionId()));
      return;
    }
    log.debug("Persisted session {} for user {}", maskSessionId(record.sessionId()), record.userId());
  }

  @Override
  @CircuitBreaker(name = "sessionStore")
  public void updateFields(String sessionId, SessionUpdate update) {
    applyUpdate(sessionId, update);
  }

  @Override
  @CircuitBreaker(name = "sessionStore")
  public Optional<SessionRecord> findById(String sessionId) {
    return load(sessionId);
  }

  @Override
  @CircuitBreaker(name = "sessionStore")
  public List<SessionRecord> findActiveByUser(String userId) {
    String userKey = USER_SESSIONS_INDEX_PREFIX + userId;
    Set<String> sessionIds = redisTemplate.opsForSet().members(userKey);
    if (sessionIds == null || sessionIds.isEmpty()) {
      return List.of();
    }

    List<String> ids = new ArrayList<>(sessionIds);
    List<String> values = redisTemplate.opsForValue().multiGet(
        ids.stream().map(id -> SESSION_KEY_PREFIX + id).toList());

    Instant now = clock.instant();
    List<SessionRecord> active = new ArrayList<>();
    List<String> stale = new ArrayList<>();
    for (int i = 0; i < ids.size(); i++) {
      String json = values != null && i < values.size() ? values.get(i) : null;
      if (json == null) {
        stale.add(ids.get(i));
        continue;
      }
      SessionRecord record = read(json);
      if (record.isLiveAt(now)) {
        active.add(record);
      }
    }

    if (!stale.isEmpty()) {
      redisTemplate.opsForSet().remove(userKey, stale.toArray());
    }
    return active;
  }

  @Override
  @CircuitBreaker(name = "sessionStore")
  public int bulkDeactivateExpired(Instant before) {
    Set<String> expiredIds = redisTemplate.opsForZSet()
        .rangeByScore(EXPIRY_INDEX_KEY, 0, before.toEpochMilli());
    if (expiredIds == null || expiredIds.isEmpty()) {
      return 0;
    }

    int deactivated = 0;
    for (String sessionId : expiredIds) {
      if (applyUpdate(sessionId, SessionUpdate.deactivation())) {
        deactivated++;
      }
    }
    redisTemplate.opsForZSet().removeRangeByScore(EXPIRY_INDEX_KEY, 0, before.toEpochMilli());
    log.info("Deactivated {} expired session(s) in Redis", deactivated);
    return deactivated;
  }

  @Override
  @CircuitBreaker(name = "sessionStore")
  public int deactivateAllForUser(String userId, String exceptSessionId, Instant createdBefore) {
    Set<String> sessionIds = redisTemplate.opsForSet().members(USER_SESSIONS_INDEX_PREFIX + userId);
    if (sessionIds == null || sessionIds.isEmpty()) {
      return 0;
    }

    int deactivated = 0;
    for (String sessionId : sessionIds) {
      if (sessionId.equals(exceptSessionId)) {
        continue;
      }
      Optional<SessionRecord> stored = load(sessionId);
      if (stored.isPresent() && stored.get().createdAt().isBefore(createdBefore)
          && applyUpdate(sessionId, SessionUpdate.deactivation())) {
        deactivated++;
      }
    }
    return deactivated;
  }

  /**
   * Optimistic read-modify-write of one record, retried when another writer got in between.
   *
   * @return true when this call changed the record
   */
  private boolean applyUpdate(String sessionId, SessionUpdate update) {
    String sessionKey = SESSION_KEY_PREFIX + sessionId;
    for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
      String json = redisTemplate.opsForValue().get(sessionKey);
      if (json == null) {
        return false;
      }
      SessionRecord current = read(json);
      SessionRecord updated = update.applyTo(current);
      if (updated.equals(current)) {
        return false;
      }
      if (write(updated, json) == WRITTEN) {
        return true;
      }
      log.debug("Concurrent write to session {}, retrying update (attempt {})",
                maskSessionId(sessionId), attempt);
    }
    throw new SessionPersistenceException("Gave up updating session " + maskSessionId(sessionId)
                                              + " after " + MAX_UPDATE_ATTEMPTS + " conflicting writes");
  }

  private Optional<SessionRecord> load(String sessionId) {
    String json = redisTemplate.opsForValue().get(SESSION_KEY_PREFIX + sessionId);
    return json == null ? Optional.empty() : Optional.of(read(json));
  }

  /**
   * Writes the value through the script and, when it was written, updates the indexes.
   *
   * @param expected the value the record was computed from, empty for an upsert
   */
  private long write(SessionRecord record, String expected) {
    String sessionKey = SESSION_KEY_PREFIX + record.sessionId();
    String userKey = USER_SESSIONS_INDEX_PREFIX + record.userId();

    Long result = redisTemplate.execute(WRITE_SCRIPT, List.of(sessionKey), serialize(record),
                                        String.valueOf(retentionFor(record).toMillis()), expected);
    long outcome = result == null ? CONFLICT : result;
    if (outcome != WRITTEN) {
      return outcome;
    }
    if (record.active()) {
      redisTemplate.opsForSet().add(userKey, record.sessionId());
      redisTemplate.opsForZSet().add(EXPIRY_INDEX_KEY, record.sessionId(),
                                     record.expiresAt().toEpochMilli());
    } else {
      redisTemplate.opsForSet().remove(userKey, record.sessionId());
      redisTemplate.opsForZSet().remove(EXPIRY_INDEX_KEY, record.sessionId());
    }
    return outcome;
  }

  private Duration retentionFor(SessionRecord record) {
    Duration retention = properties.persistence().inactiveRetention();
    if (!record.active()) {
      return retention;
    }
    Duration untilExpiry = Duration.between(clock.instant(), record.expiresAt());
    Duration ttl = untilExpiry.plus(retention);
    return ttl.compareTo(MIN_TTL) < 0 ? MIN_TTL : ttl;
  }

  private String serialize(SessionRecord record) {
    try {
      return objectMapper.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new SessionPersistenceException("Failed to serialize session record", e);
    }
  }

  private SessionRecord read(String json) {
    try {
      return objectMapper.readValue(json, SessionRecord.class);
    } catch (JsonProcessingException e) {
      throw new SessionPersistenceException("Failed to parse session record from Redis", e);
    }
  }
}
