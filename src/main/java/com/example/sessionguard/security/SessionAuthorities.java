package com.example.sessionguard.security;

import com.example.sessionguard.properties.ApplicationProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

/**
 * Authorities granted to an authenticated session. Users listed in {@code app.session.admin-users}
 * get {@link #ADMIN_ROLE}; everyone else gets none.
 */
@Component
@RequiredArgsConstructor
public class SessionAuthorities {

  public static final String ADMIN_ROLE = "ADMIN";

  private static final List<GrantedAuthority> ADMIN =
      List.of(new SimpleGrantedAuthority("ROLE_" + ADMIN_ROLE));

  private final ApplicationProperties properties;

  public List<GrantedAuthority> authoritiesFor(String userId) {
    return properties.session().adminUsers().contains(userId) ? ADMIN : List.of();
  }
}
