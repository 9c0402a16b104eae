package com.example.sessionguard.web.rest.errors;

import com.example.sessionguard.exception.InvalidSessionRequestException;
import com.example.sessionguard.exception.ReauthenticationRequiredException;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.exception.SessionNotFoundException;
import com.example.sessionguard.web.rest.ApiConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps session and security exceptions to JSON error bodies of the form
 * {timestamp, status, error, message, path}. Messages never carry session ids.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  private final Clock clock;

  @ExceptionHandler(InvalidSessionRequestException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidRequest(
      InvalidSessionRequestException ex, WebRequest request) {
    log.warn("Invalid session request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage(), request);
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleSessionNotFound(
      SessionNotFoundException ex, WebRequest request) {
    log.debug("Session not found: {}", ex.getMessage());
    return respond(HttpStatus.NOT_FOUND, "session_not_found", ex.getMessage(), request);
  }

  /**
   * Sensitive operation attempted while a step-up challenge is pending. The header tells the
   * client to run the challenge and retry.
   */
  @ExceptionHandler(ReauthenticationRequiredException.class)
  public ResponseEntity<Map<String, Object>> handleReauthenticationRequired(
      ReauthenticationRequiredException ex, WebRequest request) {
    log.info("Sensitive operation refused pending step-up: {}", extractPath(request));
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .header(ApiConstants.Header.REAUTH_REQUIRED, "true")
        .body(createErrorBody(HttpStatus.FORBIDDEN, "reauthentication_required", ex.getMessage(), request));
  }

  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, WebRequest request) {
    log.warn("Session error: {}", ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "invalid_session", "Session is invalid or expired", request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<Map<String, Object>> handleAuthenticationException(
      AuthenticationException ex, WebRequest request) {
    log.warn("Authentication error on {}: {}", extractPath(request), ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "authentication_failed", "Authentication failed", request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleAccessDeniedException(
      AccessDeniedException ex, WebRequest request) {
    log.warn("Access denied on {}: {}", extractPath(request), ex.getMessage());
    return respond(HttpStatus.FORBIDDEN, "access_denied", "Access denied", request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "missing_parameter",
                   "Missing required parameter: " + ex.getParameterName(), request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                   "Method " + ex.getMethod() + " not supported", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error on {}", extractPath(request), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                   "An error occurred processing your request", request);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, WebRequest request) {
    return new ResponseEntity<>(createErrorBody(status, error, message, request), status);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, WebRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", clock.instant().toString());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", extractPath(request));
    return body;
  }

  private String extractPath(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }
}
