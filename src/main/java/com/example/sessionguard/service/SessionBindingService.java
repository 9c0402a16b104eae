package com.example.sessionguard.service;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Derives session tokens and device correlation ids, and resolves the client address
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionBindingService {

  private static final int SESSION_ID_ENTROPY_BYTES = 32;
  private static final int DEVICE_ID_LENGTH = 16;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final Clock clock;

  /**
   * Generate an unguessable session id: SHA-256 over a millisecond timestamp and 256 random bits
   */
  public String generateSessionId() {
    byte[] randomBytes = new byte[SESSION_ID_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    String material = clock.millis() + HexFormat.of().formatHex(randomBytes);
    return sha256Hex(material);
  }

  /**
   * Generate the device correlation id for a user-agent and address pairing.
   * Deterministic, so every session from the same browser and network shares it.
   */
  public String generateDeviceId(String userAgent, String ipAddress) {
    String deviceId = sha256Hex(userAgent + ipAddress).substring(0, DEVICE_ID_LENGTH);
    log.debug("Generated device id: {}", deviceId);
    return deviceId;
  }

  /**
   * The client address as seen by the container. Forwarding headers are resolved by the container
   * ({@code server.forward-headers-strategy: native}) and only honoured when the connecting peer is
   * a trusted internal proxy, so a client cannot pick the address its session is checked against.
   */
  public String getClientIpAddress(HttpServletRequest request) {
    return request.getRemoteAddr();
  }

  private String sha256Hex(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      log.error("SHA-256 algorithm not available", e);
      throw new IllegalStateException("Failed to generate hash", e);
    }
  }
}
