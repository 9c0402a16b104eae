package com.example.sessionguard.security;

/**
 * The authenticated caller of an API request, as established from its session cookie.
 *
 * @param requiresReauth the session is flagged and the caller should run a step-up challenge
 */
public record SessionPrincipal(String userId, String sessionId, boolean requiresReauth) {}
