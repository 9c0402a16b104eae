package com.example.sessionguard.service;

import com.example.sessionguard.adapter.geo.LocationResolver;
import com.example.sessionguard.domain.dto.CreatedSession;
import com.example.sessionguard.domain.dto.SessionCreationRequest;
import com.example.sessionguard.domain.dto.SessionInvalidReason;
import com.example.sessionguard.domain.dto.SessionStatistics;
import com.example.sessionguard.domain.dto.SessionValidationResult;
import com.example.sessionguard.domain.entity.DeviceFingerprint;
import com.example.sessionguard.domain.entity.DeviceInfo;
import com.example.sessionguard.domain.entity.SecurityEventType;
import com.example.sessionguard.domain.entity.SecurityFlags;
import com.example.sessionguard.domain.entity.SessionLocation;
import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.SessionUpdate;
import com.example.sessionguard.domain.entity.TerminationReason;
import com.example.sessionguard.exception.InvalidSessionRequestException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.properties.ApplicationProperties.SessionProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.example.sessionguard.util.LogMasking.maskIpAddress;
import static com.example.sessionguard.util.LogMasking.maskSessionId;

/**
 * Creates, validates and terminates sessions. This is the only entry point the authentication
 * layer and the request filter talk to.
 * <p>
 * Security heuristics annotate sessions and never deny access: a flagged session stays valid and
 * the caller decides whether to run a step-up challenge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLifecycleService implements SessionTerminator {

  private final SessionRecordStore store;
  private final SecurityHeuristics heuristics;
  private final CapacityEnforcer capacityEnforcer;
  private final UserSessionLockService lockService;
  private final SessionBindingService bindingService;
  private final UserAgentClassifier userAgentClassifier;
  private final SecurityEventPublisher eventPublisher;
  private final LocationResolver locationResolver;
  private final DeviceFingerprintRegistry fingerprintRegistry;
  private final ApplicationProperties properties;
  private final Clock clock;

  /**
   * Creates a session for a user whose credentials have already been verified. Enforcement of the
   * per-user session limit and the insert run under the user's lock, so concurrent logins of the
   * same user never exceed the limit.
   *
   * @throws InvalidSessionRequestException if the user id, address or user agent is blank
   */
  public CreatedSession createSession(String userId, SessionCreationRequest request) {
    requireText(userId, "userId");
    if (request == null) {
      throw new InvalidSessionRequestException("Session creation request is required");
    }
    requireText(request.ipAddress(), "ipAddress");
    requireText(request.userAgent(), "userAgent");

    return lockService.withUserLock(userId, () -> insertSession(userId, request));
  }

  private CreatedSession insertSession(String userId, SessionCreationRequest request) {
    SessionProperties config = properties.session();
    String sessionId = bindingService.generateSessionId();
    String deviceId = bindingService.generateDeviceId(request.userAgent(), request.ipAddress());

    if (!config.enableConcurrentSessions()) {
      terminateAllUserSessions(userId, null);
    } else {
      capacityEnforcer.enforce(userId, this);
    }

    DeviceInfo deviceInfo = userAgentClassifier.classify(request.userAgent());
    boolean suspicious = heuristics.detectAtCreation(userId, request.ipAddress(), deviceId);

    Instant now = clock.instant();
    Duration lifetime = request.rememberMe()
        ? config.extendedSessionTimeout()
        : config.sessionTimeout();
    Instant expiresAt = now.plus(lifetime);

    SessionLocation location = config.enableLocationTracking()
        ? resolveLocation(request.ipAddress())
        : null;

    DeviceFingerprint fingerprint = request.deviceFingerprint();
    if (config.enableDeviceTracking() && fingerprint != null) {
      fingerprintRegistry.register(deviceId, fingerprint);
    }

    SessionRecord session = new SessionRecord(
        sessionId,
        userId,
        deviceId,
        request.ipAddress(),
        request.userAgent(),
        deviceInfo,
        location,
        now,
        now,
        expiresAt,
        true,
        SecurityFlags.atCreation(request.secureTransport(), suspicious));
    store.create(session);

    Map<String, Object> metadata = new HashMap<>();
    metadata.put("sessionId", maskSessionId(sessionId));
    metadata.put("deviceId", deviceId);
    metadata.put("ipAddress", maskIpAddress(request.ipAddress()));
    metadata.put("deviceInfo", deviceInfo.browser() + " on " + deviceInfo.os());
    metadata.put("rememberMe", request.rememberMe());
    metadata.put("suspicious", suspicious);
    eventPublisher.publish(userId, SecurityEventType.SESSION_CREATED, metadata);
    if (suspicious) {
      eventPublisher.publish(userId, SecurityEventType.SUSPICIOUS_ACTIVITY, Map.of(
          "sessionId", maskSessionId(sessionId),
          "deviceId", deviceId,
          "ipAddress", maskIpAddress(request.ipAddress())));
    }

    log.info("Created session {} for user {} ({} on {}, expires {})",
             maskSessionId(sessionId), userId, deviceInfo.browser(), deviceInfo.os(), expiresAt);
    return new CreatedSession(sessionId, expiresAt);
  }

  /**
   * Validates a session for the current request and records the activity. Checks run in a fixed
   * order and the first failure wins: unknown, expired, inactive, idle too long. A changed client
   * address only flags the session.
   *
   * @param ipAddress the address of the current request, may be null
   */
  public SessionValidationResult validateSession(String sessionId, String ipAddress) {
    if (sessionId == null || sessionId.isBlank()) {
      return SessionValidationResult.invalid(SessionInvalidReason.NOT_FOUND);
    }

    try {
      Optional<SessionRecord> found = store.get(sessionId);
      if (found.isEmpty()) {
        return SessionValidationResult.invalid(SessionInvalidReason.NOT_FOUND);
      }
      SessionRecord session = found.get();
      Instant now = clock.instant();

      if (session.isExpiredAt(now)) {
        terminateSession(sessionId, TerminationReason.EXPIRED);
        return SessionValidationResult.invalid(SessionInvalidReason.EXPIRED);
      }
      if (!session.active()) {
        return SessionValidationResult.invalid(SessionInvalidReason.INACTIVE);
      }
      Duration idle = Duration.between(session.lastActivity(), now);
      if (idle.compareTo(properties.session().inactivityTimeout()) > 0) {
        terminateSession(sessionId, TerminationReason.INACTIVITY);
        return SessionValidationResult.invalid(SessionInvalidReason.INACTIVITY_TIMEOUT);
      }

      SessionUpdate update;
      if (heuristics.ipChanged(session, ipAddress) && !session.securityFlags().requiresReauth()) {
        update = SessionUpdate.touch(now, session.securityFlags().withIpChange());
        eventPublisher.publish(session.userId(), SecurityEventType.IP_CHANGE, Map.of(
            "sessionId", maskSessionId(sessionId),
            "oldIp", maskIpAddress(session.ipAddress()),
            "newIp", maskIpAddress(ipAddress)));
        log.warn("Client address of session {} changed from {} to {}",
                 maskSessionId(sessionId), maskIpAddress(session.ipAddress()),
                 maskIpAddress(ipAddress));
      } else {
        update = SessionUpdate.touch(now);
      }

      SessionRecord refreshed = store.updateFields(sessionId, update)
          .orElseGet(() -> update.applyTo(session));
      return SessionValidationResult.valid(refreshed, refreshed.securityFlags().requiresReauth());
    } catch (RuntimeException e) {
      log.error("Failed to validate session {}", maskSessionId(sessionId), e);
      return SessionValidationResult.invalid(SessionInvalidReason.VALIDATION_ERROR);
    }
  }

  /**
   * As {@link #validateSession(String, String)}, for operations that warrant a recent step-up.
   * When step-up for sensitive operations is enabled, sessions that are not trusted also report
   * {@code requiresReauth}.
   */
  public SessionValidationResult validateSessionForSensitiveOperation(String sessionId, String ipAddress) {
    SessionValidationResult result = validateSession(sessionId, ipAddress);
    if (!result.valid() || result.requiresReauth()
        || !properties.session().requireReauthForSensitive()) {
      return result;
    }
    boolean untrusted = !result.session().securityFlags().trusted();
    return untrusted ? SessionValidationResult.valid(result.session(), true) : result;
  }

  /**
   * Clears the step-up requirement after the caller's challenge succeeded.
   *
   * @param ipAddress the address the challenge was completed from; the session is bound to it
   * @return false when the session is unknown or no longer live
   */
  public boolean completeReauthentication(String sessionId, String ipAddress) {
    Optional<SessionRecord> found = store.get(sessionId);
    if (found.isEmpty() || !found.get().isLiveAt(clock.instant())) {
      return false;
    }
    SessionRecord session = found.get();
    String boundAddress = ipAddress == null || ipAddress.isBlank() ? null : ipAddress;
    store.updateFields(sessionId, SessionUpdate.reauthenticated(
        session.securityFlags().withReauthCompleted(), boundAddress));

    Map<String, Object> metadata = new HashMap<>();
    metadata.put("sessionId", maskSessionId(sessionId));
    if (boundAddress != null) {
      metadata.put("ipAddress", maskIpAddress(boundAddress));
    }
    eventPublisher.publish(session.userId(), SecurityEventType.REAUTHENTICATED, metadata);
    log.info("Step-up completed for session {} of user {}", maskSessionId(sessionId), session.userId());
    return true;
  }

  /**
   * Ends a session. Safe to call repeatedly and for unknown ids; failures are logged, never
   * thrown. A termination event is published only by the call that actually ended the session.
   */
  public void terminateSession(String sessionId, TerminationReason reason) {
    try {
      // Loads durable-only sessions into the cache so the deactivation below is observed.
      store.get(sessionId);
      Optional<SessionRecord> ended = store.markInactive(sessionId);
      store.evict(sessionId);
      ended.ifPresent(session -> publishTermination(session, reason));
    } catch (RuntimeException e) {
      log.error("Failed to terminate session {}", maskSessionId(sessionId), e);
    }
  }

  /**
   * Ends a session the caller already holds, e.g. one picked for eviction.
   */
  @Override
  public void terminate(SessionRecord session, TerminationReason reason) {
    store.markInactive(session.sessionId());
    store.evict(session.sessionId());
    publishTermination(session, reason);
  }

  /**
   * Ends every active session of a user, except {@code exceptSessionId} when given, and queues a
   * durable bulk deactivation that also covers sessions only the durable store knows about.
   *
   * @return the number of sessions ended
   */
  public int terminateAllUserSessions(String userId, String exceptSessionId) {
    return lockService.withUserLock(userId, () -> {
      int terminated = 0;
      for (SessionRecord session : store.listActiveByUser(userId)) {
        if (session.sessionId().equals(exceptSessionId)) {
          continue;
        }
        terminate(session, TerminationReason.FORCE_LOGOUT);
        terminated++;
      }
      store.deactivateAllForUser(userId, exceptSessionId);
      log.info("Terminated {} session(s) for user {}", terminated, userId);
      return terminated;
    });
  }

  /**
   * Active sessions of a user, most recently active first.
   */
  public List<SessionRecord> getUserSessions(String userId) {
    return store.listActiveByUser(userId).stream()
        .sorted(Comparator.comparing(SessionRecord::lastActivity).reversed())
        .toList();
  }

  public SessionStatistics getSessionStatistics() {
    Instant now = clock.instant();
    Collection<SessionRecord> live = store.cachedRecords().stream()
        .filter(session -> session.isLiveAt(now))
        .toList();

    long totalUsers = live.stream().map(SessionRecord::userId).distinct().count();
    double averageMinutes = live.stream()
        .mapToLong(session -> Duration.between(session.createdAt(), now).toMillis())
        .average()
        .orElse(0) / Duration.ofMinutes(1).toMillis();

    return new SessionStatistics(live.size(), (int) totalUsers, averageMinutes,
                                 heuristics.suspiciousActivityCount());
  }

  public Optional<DeviceFingerprint> getDeviceFingerprint(String deviceId) {
    return fingerprintRegistry.find(deviceId);
  }

  private void publishTermination(SessionRecord session, TerminationReason reason) {
    Instant now = clock.instant();
    eventPublisher.publish(session.userId(), SecurityEventType.SESSION_TERMINATED, Map.of(
        "sessionId", maskSessionId(session.sessionId()),
        "reason", reason.value(),
        "durationMinutes", Duration.between(session.createdAt(), now).toMinutes()));
    log.info("Terminated session {} for user {}: {}",
             maskSessionId(session.sessionId()), session.userId(), reason.value());
  }

  private SessionLocation resolveLocation(String ipAddress) {
    try {
      return locationResolver.resolve(ipAddress).orElse(null);
    } catch (RuntimeException e) {
      log.warn("Location lookup failed for {}", maskIpAddress(ipAddress), e);
      return null;
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new InvalidSessionRequestException(name + " must not be blank");
    }
  }
}
