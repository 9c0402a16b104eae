package com.example.sessionguard.domain.entity;

/**
 * Client-reported device characteristics, keyed by device id.
 * A weak correlation record used only by heuristics; never an authorization input.
 */
public record DeviceFingerprint(
    String userAgent,
    String screen,
    String timezone,
    String language,
    String platform,
    boolean cookieEnabled,
    boolean doNotTrack,
    String hash
) {}
