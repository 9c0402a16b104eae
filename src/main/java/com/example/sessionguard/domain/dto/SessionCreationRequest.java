package com.example.sessionguard.domain.dto;

import com.example.sessionguard.domain.entity.DeviceFingerprint;

/**
 * What the authentication layer knows about the client once credentials have been verified.
 */
public record SessionCreationRequest(
    String ipAddress,
    String userAgent,
    boolean rememberMe,
    boolean secureTransport,
    DeviceFingerprint deviceFingerprint
) {

  public static SessionCreationRequest of(String ipAddress, String userAgent) {
    return new SessionCreationRequest(ipAddress, userAgent, false, true, null);
  }
}
