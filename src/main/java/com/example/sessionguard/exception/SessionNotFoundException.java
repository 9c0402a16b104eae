package com.example.sessionguard.exception;

public class SessionNotFoundException extends SessionException {
  public SessionNotFoundException(String message) {
    super(message);
  }
}
