package com.example.sessionguard.domain.entity;

import java.time.Instant;

/**
 * A partial update of a {@link SessionRecord}. Null fields are left untouched.
 * An update can deactivate a session but never reactivate one.
 */
public record SessionUpdate(
    Instant lastActivity,
    SecurityFlags securityFlags,
    String ipAddress,
    boolean deactivate
) {

  public static SessionUpdate touch(Instant lastActivity) {
    return new SessionUpdate(lastActivity, null, null, false);
  }

  public static SessionUpdate touch(Instant lastActivity, SecurityFlags securityFlags) {
    return new SessionUpdate(lastActivity, securityFlags, null, false);
  }

  /**
   * Clears the step-up requirement and, when an address is given, binds the session to it.
   */
  public static SessionUpdate reauthenticated(SecurityFlags securityFlags, String ipAddress) {
    return new SessionUpdate(null, securityFlags, ipAddress, false);
  }

  public static SessionUpdate deactivation() {
    return new SessionUpdate(null, null, null, true);
  }

  public SessionRecord applyTo(SessionRecord record) {
    SessionRecord result = record;
    if (lastActivity != null) {
      result = result.touchedAt(lastActivity);
    }
    if (securityFlags != null) {
      result = result.withSecurityFlags(securityFlags);
    }
    if (ipAddress != null) {
      result = result.boundTo(ipAddress);
    }
    if (deactivate) {
      result = result.deactivated();
    }
    return result;
  }
}
