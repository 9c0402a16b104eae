package com.example.sessionguard.domain.entity;

import com.example.sessionguard.support.SessionRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SessionRecord Tests")
class SessionRecordTest {

  private static final Instant CREATED = Instant.parse("2026-07-01T10:00:00Z");

  @Test
  @DisplayName("Should reject an expiry that is not after creation")
  void shouldRejectNonPositiveLifetime() {
    assertThatThrownBy(() -> new SessionRecord(SessionRecords.sessionId(1), "erin", "d", "10.0.0.1", "ua",
                                               null, null, CREATED, CREATED, CREATED, true, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("expiresAt");
  }

  @Test
  @DisplayName("Should default missing activity, device info and flags")
  void shouldApplyDefaults() {
    SessionRecord record = new SessionRecord(SessionRecords.sessionId(1), "erin", "d", "10.0.0.1", "ua",
                                             null, null, CREATED, null, CREATED.plusSeconds(60), true, null);

    assertThat(record.lastActivity()).isEqualTo(CREATED);
    assertThat(record.deviceInfo()).isEqualTo(DeviceInfo.unknown());
    assertThat(record.securityFlags().requiresReauth()).isFalse();
  }

  @Test
  @DisplayName("Should count the expiry instant itself as still live")
  void shouldTreatExpiryBoundaryAsLive() {
    SessionRecord record = SessionRecords.active(SessionRecords.sessionId(2), "erin", CREATED);

    assertThat(record.isLiveAt(record.expiresAt())).isTrue();
    assertThat(record.isLiveAt(record.expiresAt().plusMillis(1))).isFalse();
  }

  @Test
  @DisplayName("Should never reactivate through an update")
  void shouldStayInactive() {
    SessionRecord inactive = SessionRecords.active(SessionRecords.sessionId(3), "erin", CREATED).deactivated();

    SessionRecord updated = SessionUpdate.touch(CREATED.plus(Duration.ofMinutes(1)),
                                                SecurityFlags.atCreation(true, false)).applyTo(inactive);

    assertThat(updated.active()).isFalse();
    assertThat(updated.deactivated()).isSameAs(updated);
  }

  @Test
  @DisplayName("Should bind to the step-up address and clear the requirement")
  void shouldApplyReauthentication() {
    SessionRecord flagged = SessionRecords.active(SessionRecords.sessionId(4), "erin", CREATED);
    flagged = flagged.withSecurityFlags(flagged.securityFlags().withIpChange());

    SessionRecord updated = SessionUpdate.reauthenticated(
        flagged.securityFlags().withReauthCompleted(), "198.51.100.9").applyTo(flagged);

    assertThat(updated.ipAddress()).isEqualTo("198.51.100.9");
    assertThat(updated.securityFlags().requiresReauth()).isFalse();
    assertThat(updated.securityFlags().suspiciousActivity()).isTrue();
  }
}
