package com.example.sessionguard.adapter.redis.client;

import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.SessionUpdate;
import com.example.sessionguard.exception.SessionPersistenceException;
import com.example.sessionguard.support.MutableClock;
import com.example.sessionguard.support.SessionRecords;
import com.example.sessionguard.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.sessionguard.adapter.redis.client.RedisDurableSessionStore.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisDurableSessionStore Tests")
class RedisDurableSessionStoreTest {

  private static final String USER = "grace";

  @Mock
  private StringRedisTemplate redisTemplate;

  @Mock
  private ValueOperations<String, String> valueOps;

  @Mock
  private SetOperations<String, String> setOps;

  @Mock
  private ZSetOperations<String, String> zSetOps;

  private final Map<String, String> values = new HashMap<>();
  private final Map<String, Duration> ttls = new HashMap<>();
  private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
  private MutableClock clock;
  private RedisDurableSessionStore store;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-08-01T12:00:00Z");
    store = new RedisDurableSessionStore(redisTemplate, objectMapper, TestProperties.defaults(), clock);

    lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
    lenient().when(redisTemplate.opsForSet()).thenReturn(setOps);
    lenient().when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
    lenient().when(valueOps.get(anyString())).thenAnswer(invocation -> values.get(invocation.<String>getArgument(0)));
    lenient().when(redisTemplate.execute(eq(WRITE_SCRIPT), anyList(), any(), any(), any()))
        .thenAnswer(invocation -> runWriteScript(invocation.<List<String>>getArgument(1).get(0),
                                                 invocation.getArgument(2),
                                                 invocation.getArgument(3),
                                                 invocation.getArgument(4)));
    lenient().when(valueOps.multiGet(anyCollection())).thenAnswer(invocation -> {
      Collection<String> keys = invocation.getArgument(0);
      return keys.stream().map(values::get).toList();
    });
  }

  /**
   * Same contract as the Lua script: compare-and-set for updates, inactive records kept on upsert.
   */
  private long runWriteScript(String key, String value, String ttlMillis, String expected) throws Exception {
    String current = values.get(key);
    if (!expected.isEmpty()) {
      if (!expected.equals(current)) {
        return CONFLICT;
      }
    } else if (current != null && !objectMapper.readTree(current).path("active").asBoolean(true)) {
      return KEPT_INACTIVE;
    }
    values.put(key, value);
    ttls.put(key, Duration.ofMillis(Long.parseLong(ttlMillis)));
    return WRITTEN;
  }

  private void stored(SessionRecord record) throws Exception {
    values.put(SESSION_KEY_PREFIX + record.sessionId(), objectMapper.writeValueAsString(record));
  }

  private SessionRecord read(String sessionId) throws Exception {
    return objectMapper.readValue(values.get(SESSION_KEY_PREFIX + sessionId), SessionRecord.class);
  }

  @Nested
  @DisplayName("Writes")
  class WriteTests {

    @Test
    @DisplayName("Should store an active record with its indexes and a TTL covering expiry plus retention")
    void shouldUpsertActiveRecord() throws Exception {
      // Arrange
      SessionRecord record = SessionRecords.active(SessionRecords.sessionId(1), USER, clock.instant());

      // Act
      store.upsert(record);

      // Assert
      assertThat(ttls).containsEntry(SESSION_KEY_PREFIX + record.sessionId(),
                                     Duration.ofHours(8).plus(Duration.ofDays(1)));
      verify(setOps).add(USER_SESSIONS_INDEX_PREFIX + USER, record.sessionId());
      verify(zSetOps).add(EXPIRY_INDEX_KEY, record.sessionId(), record.expiresAt().toEpochMilli());
      assertThat(read(record.sessionId())).isEqualTo(record);
    }

    @Test
    @DisplayName("Should unindex a deactivated record but keep it for the retention period")
    void shouldUnindexDeactivatedRecord() throws Exception {
      // Arrange
      SessionRecord record = SessionRecords.active(SessionRecords.sessionId(2), USER, clock.instant());
      stored(record);

      // Act
      store.updateFields(record.sessionId(), SessionUpdate.deactivation());

      // Assert
      assertThat(read(record.sessionId()).active()).isFalse();
      assertThat(ttls).containsEntry(SESSION_KEY_PREFIX + record.sessionId(), Duration.ofDays(1));
      verify(setOps).remove(USER_SESSIONS_INDEX_PREFIX + USER, record.sessionId());
      verify(zSetOps).remove(EXPIRY_INDEX_KEY, record.sessionId());
    }

    @Test
    @DisplayName("Should ignore updates for records that no longer exist")
    void shouldIgnoreUpdateOfMissingRecord() {
      store.updateFields(SessionRecords.sessionId(3), SessionUpdate.touch(clock.instant()));

      assertThat(values).isEmpty();
      verifyNoInteractions(setOps, zSetOps);
    }

    @Test
    @DisplayName("Should never replace an inactive record with a late upsert of the active one")
    void shouldKeepInactiveRecordOnUpsert() throws Exception {
      // Arrange
      SessionRecord record = SessionRecords.active(SessionRecords.sessionId(15), USER, clock.instant());
      stored(record.deactivated());

      // Act
      store.upsert(record);

      // Assert
      assertThat(read(record.sessionId()).active()).isFalse();
      verifyNoInteractions(setOps, zSetOps);
    }

    @Test
    @DisplayName("Should retry an update computed from a copy another writer has since deactivated")
    void shouldRetryUpdateAfterConcurrentDeactivation() throws Exception {
      // Arrange
      SessionRecord record = SessionRecords.active(SessionRecords.sessionId(16), USER, clock.instant());
      stored(record);
      String key = SESSION_KEY_PREFIX + record.sessionId();
      String staleJson = values.get(key);
      String inactiveJson = objectMapper.writeValueAsString(record.deactivated());
      when(valueOps.get(key))
          .thenAnswer(invocation -> {
            values.put(key, inactiveJson);
            return staleJson;
          })
          .thenAnswer(invocation -> values.get(key));
      clock.advance(Duration.ofMinutes(2));

      // Act
      store.updateFields(record.sessionId(), SessionUpdate.touch(clock.instant()));

      // Assert
      SessionRecord stored = read(record.sessionId());
      assertThat(stored.active()).isFalse();
      assertThat(stored.lastActivity()).isEqualTo(clock.instant());
      verify(valueOps, times(2)).get(key);
    }
  }

  @Nested
  @DisplayName("Reads")
  class ReadTests {

    @Test
    @DisplayName("Should parse a stored record")
    void shouldFindById() throws Exception {
      SessionRecord record = SessionRecords.active(SessionRecords.sessionId(4), USER, clock.instant());
      stored(record);

      assertThat(store.findById(record.sessionId())).contains(record);
      assertThat(store.findById(SessionRecords.sessionId(5))).isEmpty();
    }

    @Test
    @DisplayName("Should surface corrupt JSON as a persistence error")
    void shouldRejectCorruptRecord() {
      values.put(SESSION_KEY_PREFIX + SessionRecords.sessionId(6), "{not json");

      assertThatThrownBy(() -> store.findById(SessionRecords.sessionId(6)))
          .isInstanceOf(SessionPersistenceException.class);
    }

    @Test
    @DisplayName("Should return live sessions of a user and prune dangling index entries")
    void shouldFindActiveByUser() throws Exception {
      // Arrange
      SessionRecord live = SessionRecords.active(SessionRecords.sessionId(7), USER, clock.instant());
      SessionRecord expired = SessionRecords.active(SessionRecords.sessionId(8), USER,
                                                    clock.instant().minus(Duration.ofHours(9)));
      stored(live);
      stored(expired);
      String dangling = SessionRecords.sessionId(9);
      when(setOps.members(USER_SESSIONS_INDEX_PREFIX + USER))
          .thenReturn(new LinkedHashSet<>(List.of(live.sessionId(), expired.sessionId(), dangling)));

      // Act
      List<SessionRecord> active = store.findActiveByUser(USER);

      // Assert
      assertThat(active).containsExactly(live);
      verify(setOps).remove(USER_SESSIONS_INDEX_PREFIX + USER, dangling);
    }
  }

  @Nested
  @DisplayName("Bulk deactivation")
  class BulkTests {

    @Test
    @DisplayName("Should deactivate sessions past their expiry and trim the expiry index")
    void shouldBulkDeactivateExpired() throws Exception {
      // Arrange
      SessionRecord expired = SessionRecords.active(SessionRecords.sessionId(10), USER,
                                                    clock.instant().minus(Duration.ofHours(9)));
      stored(expired);
      Instant now = clock.instant();
      when(zSetOps.rangeByScore(EXPIRY_INDEX_KEY, 0, now.toEpochMilli()))
          .thenReturn(Set.of(expired.sessionId(), SessionRecords.sessionId(11)));

      // Act
      int deactivated = store.bulkDeactivateExpired(now);

      // Assert
      assertThat(deactivated).isEqualTo(1);
      assertThat(read(expired.sessionId()).active()).isFalse();
      verify(zSetOps).removeRangeByScore(EXPIRY_INDEX_KEY, 0, now.toEpochMilli());
    }

    @Test
    @DisplayName("Should deactivate a user's older sessions except the one kept")
    void shouldDeactivateAllForUser() throws Exception {
      // Arrange
      SessionRecord kept = SessionRecords.active(SessionRecords.sessionId(12), USER, clock.instant());
      SessionRecord other = SessionRecords.active(SessionRecords.sessionId(13), USER, clock.instant());
      SessionRecord newer = SessionRecords.active(SessionRecords.sessionId(14), USER,
                                                  clock.instant().plusSeconds(5));
      stored(kept);
      stored(other);
      stored(newer);
      when(setOps.members(USER_SESSIONS_INDEX_PREFIX + USER))
          .thenReturn(Set.of(kept.sessionId(), other.sessionId(), newer.sessionId()));

      // Act
      int deactivated = store.deactivateAllForUser(USER, kept.sessionId(), clock.instant().plusSeconds(1));

      // Assert
      assertThat(deactivated).isEqualTo(1);
      assertThat(read(other.sessionId()).active()).isFalse();
      assertThat(read(kept.sessionId()).active()).isTrue();
      assertThat(read(newer.sessionId()).active()).isTrue();
    }
  }
}
