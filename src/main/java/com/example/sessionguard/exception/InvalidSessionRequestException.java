package com.example.sessionguard.exception;

/**
 * Rejected input, e.g. a blank user id on session creation
 */
public class InvalidSessionRequestException extends SessionException {
  public InvalidSessionRequestException(String message) {
    super(message);
  }
}
