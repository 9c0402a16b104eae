package com.example.sessionguard.exception;

/**
 * Durable store failure. Logged by the store and never propagated to the request path.
 */
public class SessionPersistenceException extends SessionException {
  public SessionPersistenceException(String message) {
    super(message);
  }

  public SessionPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
