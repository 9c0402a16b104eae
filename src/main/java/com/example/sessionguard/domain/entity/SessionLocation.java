package com.example.sessionguard.domain.entity;

/**
 * Approximate location of the client, resolved from its IP address when location tracking is on.
 */
public record SessionLocation(
    String country,
    String city,
    String timezone
) {}
