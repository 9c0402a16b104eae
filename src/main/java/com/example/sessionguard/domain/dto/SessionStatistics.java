package com.example.sessionguard.domain.dto;

/**
 * Snapshot of the in-process session population for the security dashboard.
 */
public record SessionStatistics(
    int activeSessions,
    int totalUsers,
    double averageSessionDurationMinutes,
    long suspiciousActivities
) {}
