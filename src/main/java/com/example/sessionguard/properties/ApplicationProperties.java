package com.example.sessionguard.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Centralized configuration properties for the session service.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid SessionProperties session,
    @NotNull @Valid HeuristicsProperties heuristics,
    @NotNull @Valid JanitorProperties janitor,
    @NotNull @Valid PersistenceProperties persistence,
    @NotNull @Valid RedisProperties redis,
    @NotNull @Valid CacheProperties cache
) {

  /**
   * Session lifecycle policy
   */
  public record SessionProperties(
      @DefaultValue("5") @Positive int maxSessions,
      @DefaultValue("480") @Positive int sessionTimeoutMinutes,
      @DefaultValue("10080") @Positive int extendedSessionTimeoutMinutes,
      @DefaultValue("30") @Positive int inactivityTimeoutMinutes,
      @DefaultValue("true") boolean requireReauthForSensitive,
      @DefaultValue("true") boolean enableConcurrentSessions,
      @DefaultValue("true") boolean enableDeviceTracking,
      @DefaultValue("false") boolean enableLocationTracking,
      @DefaultValue("true") boolean enableSuspiciousActivityDetection,
      @DefaultValue List<String> adminUsers
  ) {
    public Duration sessionTimeout() {
      return Duration.ofMinutes(sessionTimeoutMinutes);
    }

    public Duration extendedSessionTimeout() {
      return Duration.ofMinutes(extendedSessionTimeoutMinutes);
    }

    public Duration inactivityTimeout() {
      return Duration.ofMinutes(inactivityTimeoutMinutes);
    }
  }

  /**
   * Suspicious-activity heuristics applied when a session is created
   */
  public record HeuristicsProperties(
      @DefaultValue("3") @PositiveOrZero int rapidCreationThreshold,
      @DefaultValue("PT5M") Duration rapidCreationWindow,
      @DefaultValue("2") @Min(1) @Max(4) int ipPrefixOctets
  ) {}

  /**
   * Background sweep of expired and inactive sessions
   */
  public record JanitorProperties(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("PT5M") Duration interval,
      @DefaultValue("PT5M") Duration initialDelay
  ) {}

  /**
   * Write-behind executor for durable writes and security events
   */
  public record PersistenceProperties(
      @DefaultValue("2") @Positive int corePoolSize,
      @DefaultValue("8") @Positive int maxPoolSize,
      @DefaultValue("10000") @Positive int queueCapacity,
      @DefaultValue("P1D") Duration inactiveRetention,
      @DefaultValue("10000") @Positive int securityEventLogSize
  ) {}

  /**
   * Redis configuration with cluster support
   */
  public record RedisProperties(
      @DefaultValue("standalone") @Pattern(regexp = "standalone|cluster") String mode,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @NotNull @Valid SslProperties ssl,
      @Valid ClusterProperties cluster,
      @DefaultValue("PT2S") Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("false") boolean enabled
    ) {}

    public record ClusterProperties(
        String nodes,
        @DefaultValue("3") @Min(0) @Max(5) int maxRedirects
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @PositiveOrZero int minIdle,
        @DefaultValue("PT2S") Duration maxWait,
        @DefaultValue("PT30S") Duration timeBetweenEvictionRuns
    ) {}
  }

  /**
   * In-process session cache
   */
  public record CacheProperties(
      @NotNull @Valid SessionCacheProperties session
  ) {
    public record SessionCacheProperties(
        @DefaultValue("100000") @Positive int maxSize
    ) {}
  }
}
