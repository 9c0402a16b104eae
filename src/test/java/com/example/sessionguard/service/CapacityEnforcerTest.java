package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.SessionUpdate;
import com.example.sessionguard.domain.entity.TerminationReason;
import com.example.sessionguard.support.SessionRecords;
import com.example.sessionguard.support.TestProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CapacityEnforcer Tests")
class CapacityEnforcerTest {

  private static final String USER = "carol";
  private static final Instant T0 = Instant.parse("2026-04-01T10:00:00Z");

  @Mock
  private SessionRecordStore store;

  @Mock
  private SessionTerminator terminator;

  private SessionRecord session(int n, long createdMinute, long lastActiveMinute) {
    SessionRecord record = SessionRecords.active(SessionRecords.sessionId(n), USER,
                                                 T0.plusSeconds(createdMinute * 60));
    return SessionUpdate.touch(T0.plusSeconds(lastActiveMinute * 60)).applyTo(record);
  }

  @Test
  @DisplayName("Should do nothing while below the limit")
  void shouldLeaveSessionsBelowLimit() {
    // Arrange
    when(store.listActiveByUser(USER)).thenReturn(List.of(session(1, 0, 0), session(2, 1, 1)));
    CapacityEnforcer enforcer = new CapacityEnforcer(store, TestProperties.builder().maxSessions(3).build());

    // Act
    List<String> evicted = enforcer.enforce(USER, terminator);

    // Assert
    assertThat(evicted).isEmpty();
    verifyNoInteractions(terminator);
  }

  @Test
  @DisplayName("Should evict the least recently active sessions to make room for one more")
  void shouldEvictLeastRecentlyActive() {
    // Arrange
    SessionRecord stale = session(1, 0, 2);
    SessionRecord busy = session(2, 1, 30);
    SessionRecord idle = session(3, 2, 5);
    when(store.listActiveByUser(USER)).thenReturn(List.of(busy, stale, idle));
    CapacityEnforcer enforcer = new CapacityEnforcer(store, TestProperties.builder().maxSessions(2).build());

    // Act
    List<String> evicted = enforcer.enforce(USER, terminator);

    // Assert
    assertThat(evicted).containsExactly(stale.sessionId(), idle.sessionId());
    ArgumentCaptor<SessionRecord> captor = ArgumentCaptor.forClass(SessionRecord.class);
    verify(terminator, times(2)).terminate(captor.capture(), eq(TerminationReason.SESSION_LIMIT));
    assertThat(captor.getAllValues()).containsExactly(stale, idle);
  }

  @Test
  @DisplayName("Should break activity ties by creation time")
  void shouldBreakTiesByCreation() {
    // Arrange
    SessionRecord younger = session(1, 5, 10);
    SessionRecord older = session(2, 3, 10);
    when(store.listActiveByUser(USER)).thenReturn(List.of(younger, older));
    CapacityEnforcer enforcer = new CapacityEnforcer(store, TestProperties.builder().maxSessions(2).build());

    // Act
    List<String> evicted = enforcer.enforce(USER, terminator);

    // Assert
    assertThat(evicted).containsExactly(older.sessionId());
    verify(terminator).terminate(older, TerminationReason.SESSION_LIMIT);
    verify(terminator, never()).terminate(eq(younger), any());
  }

  @Test
  @DisplayName("Should break activity and creation ties by the lexicographically smaller session id")
  void shouldBreakFullTiesBySessionId() {
    // Arrange
    SessionRecord higherId = session(0xb, 4, 12);
    SessionRecord lowerId = session(0xa, 4, 12);
    when(store.listActiveByUser(USER)).thenReturn(List.of(higherId, lowerId));
    CapacityEnforcer enforcer = new CapacityEnforcer(store, TestProperties.builder().maxSessions(2).build());

    // Act
    List<String> evicted = enforcer.enforce(USER, terminator);

    // Assert
    assertThat(lowerId.sessionId()).isLessThan(higherId.sessionId());
    assertThat(evicted).containsExactly(lowerId.sessionId());
    verify(terminator).terminate(lowerId, TerminationReason.SESSION_LIMIT);
    verify(terminator, never()).terminate(eq(higherId), any());
  }
}
