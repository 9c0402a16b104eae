package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces cross-field rules beyond basic JSR-303 validation.
 * Fails startup with every violation listed at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(ApplicationProperties.class)
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MUST_BE_POSITIVE = "%s must be at least 1.";
  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final Duration MIN_JANITOR_INTERVAL = Duration.ofSeconds(10);

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating session configuration rules...");
    List<String> errors = new ArrayList<>();

    validateSessionConfig(errors);
    validateHeuristicsConfig(errors);
    validateJanitorConfig(errors);
    validatePersistenceConfig(errors);
    validateRedisConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Session configuration validated successfully.");
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SessionProperties session = properties.session();
    if (session.maxSessions() < 1) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Max sessions per user"));
    }
    if (session.extendedSessionTimeoutMinutes() < session.sessionTimeoutMinutes()) {
      errors.add("Extended session timeout (%d min) must not be shorter than the session timeout (%d min)"
                     .formatted(session.extendedSessionTimeoutMinutes(), session.sessionTimeoutMinutes()));
    }
    if (session.inactivityTimeoutMinutes() >= session.sessionTimeoutMinutes()) {
      errors.add("Inactivity timeout (%d min) must be less than the session timeout (%d min)"
                     .formatted(session.inactivityTimeoutMinutes(), session.sessionTimeoutMinutes()));
    }
  }

  private void validateHeuristicsConfig(List<String> errors) {
    Duration window = properties.heuristics().rapidCreationWindow();
    if (window == null || window.isZero() || window.isNegative()) {
      errors.add("Rapid creation window must be a positive duration.");
    }
  }

  private void validateJanitorConfig(List<String> errors) {
    ApplicationProperties.JanitorProperties janitor = properties.janitor();
    if (!janitor.enabled()) {
      log.warn("Session janitor is disabled; expired sessions are only removed on access.");
      return;
    }
    if (janitor.interval().compareTo(MIN_JANITOR_INTERVAL) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Janitor interval", "10 seconds"));
    }
    if (janitor.initialDelay().isNegative()) {
      errors.add("Janitor initial delay cannot be negative.");
    }
  }

  private void validatePersistenceConfig(List<String> errors) {
    ApplicationProperties.PersistenceProperties persistence = properties.persistence();
    if (persistence.maxPoolSize() < persistence.corePoolSize()) {
      errors.add("Write-behind max pool size must be greater than or equal to the core pool size.");
    }
    if (persistence.inactiveRetention().isNegative() || persistence.inactiveRetention().isZero()) {
      errors.add("Inactive session retention must be a positive duration.");
    }
  }

  private void validateRedisConfig(List<String> errors) {
    ApplicationProperties.RedisProperties redis = properties.redis();
    if ("cluster".equalsIgnoreCase(redis.mode())
        && (redis.cluster() == null || redis.cluster().nodes() == null || redis.cluster().nodes().isBlank())) {
      errors.add("Redis cluster mode requires 'app.redis.cluster.nodes'.");
    }
    if (redis.pool().maxActive() < redis.pool().maxIdle()) {
      errors.add("Redis pool max-active must be greater than or equal to max-idle.");
    }
  }
}
