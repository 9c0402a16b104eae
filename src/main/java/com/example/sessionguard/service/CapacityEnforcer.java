package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.TerminationReason;
import com.example.sessionguard.properties.ApplicationProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.example.sessionguard.util.LogMasking.maskSessionId;

/**
 * Keeps the number of active sessions per user below {@code maxSessions} by evicting the least
 * recently active ones. Meant to run right before a new session is inserted, under the user's
 * lock.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CapacityEnforcer {

  /**
   * Least recently active first; ties broken by creation time, then id.
   */
  public static final Comparator<SessionRecord> EVICTION_ORDER =
      Comparator.comparing(SessionRecord::lastActivity)
          .thenComparing(SessionRecord::createdAt)
          .thenComparing(SessionRecord::sessionId);

  private final SessionRecordStore store;
  private final ApplicationProperties properties;

  /**
   * @return ids of the evicted sessions, oldest first
   */
  public List<String> enforce(String userId, SessionTerminator terminator) {
    int maxSessions = properties.session().maxSessions();
    List<SessionRecord> active = new ArrayList<>(store.listActiveByUser(userId));
    active.sort(EVICTION_ORDER);

    List<String> evicted = new ArrayList<>();
    while (!active.isEmpty() && active.size() >= maxSessions) {
      SessionRecord oldest = active.remove(0);
      terminator.terminate(oldest, TerminationReason.SESSION_LIMIT);
      evicted.add(oldest.sessionId());
      log.info("Session limit of {} reached for user {}, evicted session {}",
               maxSessions, userId, maskSessionId(oldest.sessionId()));
    }
    return evicted;
  }
}
