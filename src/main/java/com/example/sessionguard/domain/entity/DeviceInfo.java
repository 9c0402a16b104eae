package com.example.sessionguard.domain.entity;

/**
 * Best-effort classification of the client derived from its user-agent string.
 */
public record DeviceInfo(
    String browser,
    String os,
    String deviceClass,
    boolean mobile
) {

  public static final String UNKNOWN = "Unknown";

  public static DeviceInfo unknown() {
    return new DeviceInfo(UNKNOWN, UNKNOWN, "Desktop", false);
  }
}
