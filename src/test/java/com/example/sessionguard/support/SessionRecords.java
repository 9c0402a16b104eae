package com.example.sessionguard.support;

import com.example.sessionguard.domain.entity.DeviceInfo;
import com.example.sessionguard.domain.entity.SecurityFlags;
import com.example.sessionguard.domain.entity.SessionRecord;
import java.time.Duration;
import java.time.Instant;

/**
 * Factory for session records in tests.
 */
public final class SessionRecords {

  public static final String CHROME_WINDOWS =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
          + "Chrome/124.0.0.0 Safari/537.36";

  private SessionRecords() {}

  public static SessionRecord active(String sessionId, String userId, Instant createdAt) {
    return active(sessionId, userId, "10.0.0.1", createdAt);
  }

  public static SessionRecord active(String sessionId, String userId, String ipAddress, Instant createdAt) {
    return new SessionRecord(
        sessionId,
        userId,
        "device-" + userId,
        ipAddress,
        CHROME_WINDOWS,
        new DeviceInfo("Chrome", "Windows", "Desktop", false),
        null,
        createdAt,
        createdAt,
        createdAt.plus(Duration.ofHours(8)),
        true,
        SecurityFlags.atCreation(true, false));
  }

  public static String sessionId(int n) {
    return String.format("%064x", n);
  }
}
