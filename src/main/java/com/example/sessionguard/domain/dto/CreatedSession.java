package com.example.sessionguard.domain.dto;

import java.time.Instant;

public record CreatedSession(String sessionId, Instant expiresAt) {}
