package com.example.sessionguard.domain.dto;

/**
 * Why a session failed validation, in the order the checks run.
 */
public enum SessionInvalidReason {
  NOT_FOUND("Session not found"),
  EXPIRED("Session expired"),
  INACTIVE("Session inactive"),
  INACTIVITY_TIMEOUT("Session inactive too long"),
  VALIDATION_ERROR("Validation error");

  private final String message;

  SessionInvalidReason(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
