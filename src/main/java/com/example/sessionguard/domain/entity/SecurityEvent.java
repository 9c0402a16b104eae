package com.example.sessionguard.domain.entity;

import java.time.Instant;
import java.util.Map;

/**
 * An entry for the security event log.
 */
public record SecurityEvent(
    String userId,
    SecurityEventType type,
    Instant timestamp,
    Map<String, Object> metadata
) {}
