package com.example.sessionguard.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Masks session tokens and client addresses before they reach the logs.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class LogMasking {

  private static final int VISIBLE_SESSION_CHARS = 8;

  public static String maskSessionId(String sessionId) {
    if (sessionId == null || sessionId.length() < VISIBLE_SESSION_CHARS) {
      return "INVALID";
    }
    return sessionId.substring(0, VISIBLE_SESSION_CHARS) + "...";
  }

  public static String maskIpAddress(String ip) {
    if (ip == null) {
      return "***";
    }
    if (ip.contains(":")) {
      int first = ip.indexOf(':');
      return ip.substring(0, first) + ":***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }
}
