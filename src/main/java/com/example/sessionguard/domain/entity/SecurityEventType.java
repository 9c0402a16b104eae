package com.example.sessionguard.domain.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SecurityEventType {
  SESSION_CREATED("session_created"),
  SESSION_TERMINATED("session_terminated"),
  IP_CHANGE("ip_change"),
  SUSPICIOUS_ACTIVITY("suspicious_activity"),
  REAUTHENTICATED("reauthenticated");

  private final String value;

  SecurityEventType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
