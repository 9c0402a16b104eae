package com.example.sessionguard.domain.entity;

import java.time.Instant;
import java.util.Objects;

/**
 * An authenticated session.
 * <p>
 * Values are immutable; every change produces a new record that replaces the cached one.
 * Once {@code active} is false there is no way back: re-authentication always mints a new
 * session id.
 *
 * @param sessionId opaque, unguessable token, never reused
 * @param deviceId correlation hash of user-agent and IP address, not a security boundary
 * @param ipAddress the address the session is bound to: where it was created, or where the user
 *     last completed a step-up challenge
 * @param location only present when location tracking is enabled
 */
public record SessionRecord(
    String sessionId,
    String userId,
    String deviceId,
    String ipAddress,
    String userAgent,
    DeviceInfo deviceInfo,
    SessionLocation location,
    Instant createdAt,
    Instant lastActivity,
    Instant expiresAt,
    boolean active,
    SecurityFlags securityFlags
) {

  public SessionRecord {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    if (!expiresAt.isAfter(createdAt)) {
      throw new IllegalArgumentException("expiresAt must be after createdAt");
    }
    if (lastActivity == null) {
      lastActivity = createdAt;
    }
    if (deviceInfo == null) {
      deviceInfo = DeviceInfo.unknown();
    }
    if (securityFlags == null) {
      securityFlags = SecurityFlags.atCreation(false, false);
    }
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt.isBefore(now);
  }

  /**
   * Active and not past its absolute expiry.
   */
  public boolean isLiveAt(Instant now) {
    return active && !isExpiredAt(now);
  }

  /**
   * Records activity. Older timestamps are ignored so the value only moves forward.
   */
  public SessionRecord touchedAt(Instant when) {
    if (!when.isAfter(lastActivity)) {
      return this;
    }
    return new SessionRecord(sessionId, userId, deviceId, ipAddress, userAgent, deviceInfo,
                             location, createdAt, when, expiresAt, active, securityFlags);
  }

  public SessionRecord withSecurityFlags(SecurityFlags flags) {
    return new SessionRecord(sessionId, userId, deviceId, ipAddress, userAgent, deviceInfo,
                             location, createdAt, lastActivity, expiresAt, active, flags);
  }

  public SessionRecord boundTo(String newIpAddress) {
    return new SessionRecord(sessionId, userId, deviceId, newIpAddress, userAgent, deviceInfo,
                             location, createdAt, lastActivity, expiresAt, active, securityFlags);
  }

  public SessionRecord deactivated() {
    if (!active) {
      return this;
    }
    return new SessionRecord(sessionId, userId, deviceId, ipAddress, userAgent, deviceInfo,
                             location, createdAt, lastActivity, expiresAt, false, securityFlags);
  }
}
