package com.example.sessionguard.domain.entity;

/**
 * Why a session was ended. The value is what gets written to the security event log.
 */
public enum TerminationReason {
  LOGOUT("logout"),
  EXPIRED("expired"),
  INACTIVITY("inactivity"),
  SESSION_LIMIT("session_limit"),
  FORCE_LOGOUT("force_logout"),
  USER_TERMINATED("user_terminated");

  private final String value;

  TerminationReason(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
