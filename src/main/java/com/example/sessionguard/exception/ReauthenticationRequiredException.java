package com.example.sessionguard.exception;

/**
 * The operation is sensitive and the caller's session has a pending step-up challenge
 */
public class ReauthenticationRequiredException extends SessionException {
  public ReauthenticationRequiredException(String message) {
    super(message);
  }
}
