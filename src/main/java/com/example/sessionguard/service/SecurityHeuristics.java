package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.example.sessionguard.util.LogMasking.maskIpAddress;

/**
 * Advisory anomaly checks. Verdicts only annotate sessions; nothing here blocks a login or ends a
 * session.
 */
@Slf4j
@Component
public class SecurityHeuristics {

  private final SessionRecordStore store;
  private final ApplicationProperties properties;
  private final Clock clock;
  private final Cache<String, Deque<Instant>> creationLog;
  private final Map<String, AtomicLong> suspiciousCounts = new ConcurrentHashMap<>();

  public SecurityHeuristics(SessionRecordStore store, ApplicationProperties properties, Clock clock) {
    this.store = store;
    this.properties = properties;
    this.clock = clock;
    this.creationLog = Caffeine.newBuilder()
        .expireAfterAccess(properties.heuristics().rapidCreationWindow())
        .build();
  }

  /**
   * Records a session creation and judges whether it looks suspicious: too many creations for
   * the user inside the trailing window, or a network none of the user's active sessions share.
   */
  public boolean detectAtCreation(String userId, String ipAddress, String deviceId) {
    if (!properties.session().enableSuspiciousActivityDetection()) {
      return false;
    }

    int recentCreations = recordCreation(userId, clock.instant());
    int threshold = properties.heuristics().rapidCreationThreshold();
    if (recentCreations > threshold) {
      flag(userId);
      log.warn("Rapid session creation for user {}: {} session(s) in the last {} (device {})",
               userId, recentCreations, properties.heuristics().rapidCreationWindow(), deviceId);
      return true;
    }

    if (isUnfamiliarNetwork(userId, ipAddress)) {
      flag(userId);
      log.warn("Session for user {} from unfamiliar network {} (device {})",
               userId, maskIpAddress(ipAddress), deviceId);
      return true;
    }
    return false;
  }

  /**
   * Whether a request comes from an address other than the one the session was created from.
   */
  public boolean ipChanged(SessionRecord session, String ipAddress) {
    return properties.session().enableSuspiciousActivityDetection()
        && ipAddress != null
        && !ipAddress.isBlank()
        && !ipAddress.equals(session.ipAddress());
  }

  public long suspiciousActivityCount() {
    return suspiciousCounts.values().stream().mapToLong(AtomicLong::get).sum();
  }

  public long suspiciousActivityCount(String userId) {
    AtomicLong count = suspiciousCounts.get(userId);
    return count == null ? 0 : count.get();
  }

  /**
   * Leading octets of an IPv4 address, or leading hextets of an IPv6 address.
   */
  static String networkPrefix(String ipAddress, int groups) {
    if (ipAddress == null) {
      return "";
    }
    boolean ipv6 = ipAddress.contains(":");
    String[] parts = ipAddress.split(ipv6 ? ":" : "\\.");
    if (parts.length <= groups) {
      return ipAddress;
    }
    return String.join(ipv6 ? ":" : ".", Arrays.copyOf(parts, groups));
  }

  /**
   * @return how many sessions the user created inside the window before this one
   */
  private int recordCreation(String userId, Instant now) {
    Duration window = properties.heuristics().rapidCreationWindow();
    Instant cutoff = now.minus(window);
    int[] prior = new int[1];
    creationLog.asMap().compute(userId, (id, timestamps) -> {
      Deque<Instant> recent = timestamps != null ? timestamps : new ArrayDeque<>();
      while (!recent.isEmpty() && !recent.peekFirst().isAfter(cutoff)) {
        recent.pollFirst();
      }
      prior[0] = recent.size();
      recent.addLast(now);
      return recent;
    });
    return prior[0];
  }

  private boolean isUnfamiliarNetwork(String userId, String ipAddress) {
    List<SessionRecord> existing = store.listCachedActiveByUser(userId);
    if (existing.isEmpty()) {
      return false;
    }
    int groups = properties.heuristics().ipPrefixOctets();
    String prefix = networkPrefix(ipAddress, groups);
    return existing.stream()
        .noneMatch(session -> prefix.equals(networkPrefix(session.ipAddress(), groups)));
  }

  private void flag(String userId) {
    suspiciousCounts.computeIfAbsent(userId, id -> new AtomicLong()).incrementAndGet();
  }
}
