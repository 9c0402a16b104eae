package com.example.sessionguard.domain.entity;

/**
 * Advisory annotations on a session. They inform the caller's step-up decision
 * and never invalidate a session on their own.
 */
public record SecurityFlags(
    boolean secure,
    boolean trusted,
    boolean requiresReauth,
    boolean suspiciousActivity
) {

  public static SecurityFlags atCreation(boolean secureTransport, boolean suspicious) {
    return new SecurityFlags(secureTransport, !suspicious, false, suspicious);
  }

  /**
   * Flags after the client showed up from an address other than the one it logged in from.
   */
  public SecurityFlags withIpChange() {
    return new SecurityFlags(secure, trusted, true, true);
  }

  public SecurityFlags withReauthCompleted() {
    return new SecurityFlags(secure, trusted, false, suspiciousActivity);
  }
}
