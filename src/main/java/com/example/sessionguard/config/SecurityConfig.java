package com.example.sessionguard.config;

import com.example.sessionguard.security.SessionAuthorities;
import com.example.sessionguard.security.filter.SessionAuthenticationFilter;
import com.example.sessionguard.web.rest.ApiConstants.ApiPath;
import com.example.sessionguard.web.rest.errors.DelegatedAuthenticationEntryPoint;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Three filter chains, evaluated in order.
 * <p>
 * PUBLIC (@Order(1)): API documentation. PROTECTED (@Order(2)): everything under /api, where
 * {@link SessionAuthenticationFilter} validates the session cookie on every request; system-wide
 * statistics additionally need the admin role. DEFAULT
 * (@Order(3)): deny everything else.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final SessionAuthenticationFilter sessionAuthenticationFilter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/**")
        .addFilterBefore(sessionAuthenticationFilter,
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize
            .requestMatchers(HttpMethod.GET, ApiPath.API_BASE + ApiPath.SESSION + ApiPath.STATISTICS)
            .hasRole(SessionAuthorities.ADMIN_ROLE)
            .anyRequest().authenticated())
        // JSON 401 for API clients instead of a login page
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  /**
   * Deny everything not matched by the chains above
   */
  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  /**
   * The session filter only runs inside the protected chain, not as a plain servlet filter
   */
  @Bean
  public FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration() {
    FilterRegistrationBean<SessionAuthenticationFilter> registration =
        new FilterRegistrationBean<>(sessionAuthenticationFilter);
    registration.setEnabled(false);
    return registration;
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Session cookies are SameSite=Strict and HttpOnly
        .csrf(AbstractHttpConfigurer::disable)

        // Sessions live in the session store, never in the servlet container
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )

        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                                    )
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )
                     .addHeaderWriter((request, response) -> {
                       // Session listings are user-specific
                       response.setHeader("Cache-Control",
                                          "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma",
                                          "no-cache");
                     })
                );
  }
}
