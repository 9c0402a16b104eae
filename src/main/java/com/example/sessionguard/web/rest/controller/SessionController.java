package com.example.sessionguard.web.rest.controller;

import com.example.sessionguard.domain.dto.SessionStatistics;
import com.example.sessionguard.domain.dto.SessionValidationResult;
import com.example.sessionguard.domain.entity.TerminationReason;
import com.example.sessionguard.exception.ReauthenticationRequiredException;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.exception.SessionNotFoundException;
import com.example.sessionguard.security.SessionPrincipal;
import com.example.sessionguard.service.SessionBindingService;
import com.example.sessionguard.service.SessionLifecycleService;
import com.example.sessionguard.util.CookieUtil;
import com.example.sessionguard.web.rest.dto.SessionView;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static com.example.sessionguard.util.LogMasking.maskSessionId;

/**
 * Session dashboard REST controller.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final SessionLifecycleService sessionLifecycleService;
  private final SessionBindingService sessionBindingService;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> checkSession(SessionPrincipal principal) {
    return ResponseEntity.ok(Map.of(
        "authenticated", true,
        "userId", principal.userId(),
        "requiresReauth", principal.requiresReauth(),
        "timestamp", clock.millis()
                                   ));
  }

  @Override
  public ResponseEntity<List<SessionView>> listSessions(SessionPrincipal principal) {
    List<SessionView> sessions = sessionLifecycleService.getUserSessions(principal.userId()).stream()
        .map(session -> SessionView.of(session, principal.sessionId()))
        .toList();
    return ResponseEntity.ok(sessions);
  }

  @Override
  public ResponseEntity<Void> terminateSession(SessionPrincipal principal, String sessionId,
                                               HttpServletRequest request,
                                               HttpServletResponse response) {
    requireRecentAuthentication(principal, request);

    boolean owned = sessionLifecycleService.getUserSessions(principal.userId()).stream()
        .anyMatch(session -> session.sessionId().equals(sessionId));
    if (!owned) {
      throw new SessionNotFoundException("No active session with this id for the current user");
    }

    TerminationReason reason = sessionId.equals(principal.sessionId())
        ? TerminationReason.LOGOUT
        : TerminationReason.USER_TERMINATED;
    sessionLifecycleService.terminateSession(sessionId, reason);
    if (reason == TerminationReason.LOGOUT) {
      CookieUtil.clearSessionCookie(response);
    }
    log.info("User {} ended session {}", principal.userId(), maskSessionId(sessionId));
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<Map<String, Object>> terminateAllSessions(SessionPrincipal principal,
                                                                  boolean keepCurrent,
                                                                  HttpServletRequest request,
                                                                  HttpServletResponse response) {
    requireRecentAuthentication(principal, request);

    int terminated = sessionLifecycleService.terminateAllUserSessions(
        principal.userId(), keepCurrent ? principal.sessionId() : null);
    if (!keepCurrent) {
      CookieUtil.clearSessionCookie(response);
    }
    return ResponseEntity.ok(Map.of(
        "terminated", terminated,
        "keptCurrent", keepCurrent
                                   ));
  }

  @Override
  public ResponseEntity<SessionStatistics> getStatistics() {
    return ResponseEntity.ok(sessionLifecycleService.getSessionStatistics());
  }

  private void requireRecentAuthentication(SessionPrincipal principal, HttpServletRequest request) {
    SessionValidationResult result = sessionLifecycleService.validateSessionForSensitiveOperation(
        principal.sessionId(), sessionBindingService.getClientIpAddress(request));
    if (!result.valid()) {
      throw new SessionException(result.reasonMessage());
    }
    if (result.requiresReauth()) {
      throw new ReauthenticationRequiredException("Step-up authentication required for this operation");
    }
  }
}
