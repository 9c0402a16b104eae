package com.example.sessionguard.security.filter;

import com.example.sessionguard.domain.dto.SessionValidationResult;
import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.security.SessionAuthorities;
import com.example.sessionguard.security.SessionPrincipal;
import com.example.sessionguard.service.SessionBindingService;
import com.example.sessionguard.service.SessionLifecycleService;
import com.example.sessionguard.util.CookieUtil;
import com.example.sessionguard.web.rest.ApiConstants;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

import static com.example.sessionguard.util.LogMasking.maskSessionId;

/**
 * Authenticates API requests by their app_session cookie. Every request is validated through
 * {@link SessionLifecycleService}, which also records the activity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  public static final String REAUTH_REQUIRED_HEADER = ApiConstants.Header.REAUTH_REQUIRED;

  private final SessionLifecycleService sessionLifecycleService;
  private final SessionBindingService sessionBindingService;
  private final SessionAuthorities sessionAuthorities;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    Optional<String> sessionId = CookieUtil.getSessionId(request);

    if (sessionId.isPresent()) {
      String clientIp = sessionBindingService.getClientIpAddress(request);
      SessionValidationResult result = sessionLifecycleService.validateSession(sessionId.get(), clientIp);

      if (result.valid()) {
        SessionRecord session = result.session();
        SessionPrincipal principal =
            new SessionPrincipal(session.userId(), session.sessionId(), result.requiresReauth());
        SecurityContextHolder.getContext().setAuthentication(
            new UsernamePasswordAuthenticationToken(
                principal, null, sessionAuthorities.authoritiesFor(session.userId())));
        if (result.requiresReauth()) {
          response.setHeader(REAUTH_REQUIRED_HEADER, "true");
        }
        log.trace("Authenticated session {}", maskSessionId(session.sessionId()));
      } else {
        log.debug("Rejected session {}: {}. Clearing cookie.",
                  maskSessionId(sessionId.get()), result.reasonMessage());
        CookieUtil.clearSessionCookie(response);
      }
    }

    filterChain.doFilter(request, response);
  }
}
