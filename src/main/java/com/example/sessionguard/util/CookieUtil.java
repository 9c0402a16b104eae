package com.example.sessionguard.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reading and clearing the session cookie
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  public static final String SESSION_COOKIE_NAME = "app_session";
  private static final String COOKIE_PATH = "/";
  private static final String SAME_SITE_STRICT = "Strict";

  // SHA-256 hex, as minted by SessionBindingService
  private static final Pattern SESSION_ID_PATTERN = Pattern.compile("^[0-9a-f]{64}$");

  /**
   * Extract cookie by name using Spring's WebUtils
   */
  public static Optional<Cookie> getCookie(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name));
  }

  /**
   * The session id carried by the request, if it is present and well-formed
   */
  public static Optional<String> getSessionId(HttpServletRequest request) {
    return getCookie(request, SESSION_COOKIE_NAME)
        .map(Cookie::getValue)
        .filter(CookieUtil::isValidSessionId);
  }

  /**
   * Expire the session cookie on the client
   */
  public static void clearSessionCookie(HttpServletResponse response) {
    ResponseCookie cookie = ResponseCookie
        .from(SESSION_COOKIE_NAME, "")
        .httpOnly(true)
        .secure(true)
        .path(COOKIE_PATH)
        .maxAge(0)
        .sameSite(SAME_SITE_STRICT)
        .build();
    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());

    log.debug("Cleared session cookie: name={}", SESSION_COOKIE_NAME);
  }

  public static boolean isValidSessionId(String sessionId) {
    return sessionId != null && SESSION_ID_PATTERN.matcher(sessionId).matches();
  }
}
