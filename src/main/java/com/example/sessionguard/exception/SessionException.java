package com.example.sessionguard.exception;

/**
 * Base exception for session lifecycle failures
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }

  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
