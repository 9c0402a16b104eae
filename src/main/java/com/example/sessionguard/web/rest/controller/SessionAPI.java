package com.example.sessionguard.web.rest.controller;

import static com.example.sessionguard.web.rest.ApiConstants.ApiPath.*;

import com.example.sessionguard.domain.dto.SessionStatistics;
import com.example.sessionguard.security.SessionPrincipal;
import com.example.sessionguard.web.rest.dto.SessionView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Session dashboard API: lets a user see and end their own sessions.
 * All endpoints require a valid app_session cookie.
 */
@Tag(
    name = "Session Management",
    description = "Active session listing and revocation"
)
@RequestMapping(
    value = API_BASE + SESSION,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Check session validity",
      description = "Reports whether the current session is valid and whether a step-up challenge is pending"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session status returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = CHECK)
  ResponseEntity<Map<String, Object>> checkSession(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal);

  @Operation(
      summary = "List active sessions",
      description = "Active sessions of the current user, most recently active first"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = SESSIONS)
  ResponseEntity<List<SessionView>> listSessions(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal);

  @Operation(
      summary = "End one session",
      description = "Ends one of the current user's sessions"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Session ended"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Step-up challenge required"),
      @ApiResponse(responseCode = "404", description = "No such session for this user")
  })
  @DeleteMapping(value = SESSION_BY_ID)
  ResponseEntity<Void> terminateSession(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal,
      @PathVariable("sessionId") String sessionId,
      HttpServletRequest request,
      HttpServletResponse response);

  @Operation(
      summary = "End all sessions",
      description = "Ends every session of the current user, optionally keeping the current one"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Number of sessions ended"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Step-up challenge required")
  })
  @DeleteMapping(value = SESSIONS)
  ResponseEntity<Map<String, Object>> terminateAllSessions(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal,
      @RequestParam(name = "keepCurrent", defaultValue = "true") boolean keepCurrent,
      HttpServletRequest request,
      HttpServletResponse response);

  @Operation(
      summary = "Session statistics",
      description = "Snapshot of the sessions held by this instance, across all users. Admin only."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Statistics returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Caller is not an administrator")
  })
  @GetMapping(value = STATISTICS)
  ResponseEntity<SessionStatistics> getStatistics();
}
