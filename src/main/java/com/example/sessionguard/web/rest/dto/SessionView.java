package com.example.sessionguard.web.rest.dto;

import com.example.sessionguard.domain.entity.SessionLocation;
import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.util.LogMasking;
import java.time.Instant;

/**
 * One entry of the "where am I logged in" list. The address is masked.
 */
public record SessionView(
    String sessionId,
    String deviceId,
    String browser,
    String os,
    String deviceClass,
    boolean mobile,
    String ipAddress,
    SessionLocation location,
    Instant createdAt,
    Instant lastActivity,
    Instant expiresAt,
    boolean suspiciousActivity,
    boolean current
) {

  public static SessionView of(SessionRecord session, String currentSessionId) {
    return new SessionView(
        session.sessionId(),
        session.deviceId(),
        session.deviceInfo().browser(),
        session.deviceInfo().os(),
        session.deviceInfo().deviceClass(),
        session.deviceInfo().mobile(),
        LogMasking.maskIpAddress(session.ipAddress()),
        session.location(),
        session.createdAt(),
        session.lastActivity(),
        session.expiresAt(),
        session.securityFlags().suspiciousActivity(),
        session.sessionId().equals(currentSessionId));
  }
}
