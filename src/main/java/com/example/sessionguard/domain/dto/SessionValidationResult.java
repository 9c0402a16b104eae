package com.example.sessionguard.domain.dto;

import com.example.sessionguard.domain.entity.SessionRecord;

/**
 * Outcome of validating a session. Callers branch on {@link #valid()} instead of catching
 * exceptions.
 *
 * @param valid whether the session may be used for this request
 * @param session the refreshed record, only for valid sessions
 * @param requiresReauth the caller should run a step-up challenge; the session stays valid
 * @param reason why validation failed, only for invalid sessions
 */
public record SessionValidationResult(
    boolean valid,
    SessionRecord session,
    boolean requiresReauth,
    SessionInvalidReason reason
) {

  public static SessionValidationResult valid(SessionRecord session, boolean requiresReauth) {
    return new SessionValidationResult(true, session, requiresReauth, null);
  }

  public static SessionValidationResult invalid(SessionInvalidReason reason) {
    return new SessionValidationResult(false, null, false, reason);
  }

  public String reasonMessage() {
    return reason != null ? reason.message() : null;
  }
}
