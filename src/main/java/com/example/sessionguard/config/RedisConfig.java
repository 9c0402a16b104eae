package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.properties.ApplicationProperties.RedisProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connections for the durable session tier and the security event log.
 * <p>
 * Standalone or cluster, pooled Lettuce connections. Commands are rejected while disconnected
 * instead of being buffered: the write-behind path treats a failed write as dropped, and the
 * {@code sessionStore} circuit breaker needs to see the failures to open.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class RedisConfig {

  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);
  private static final Duration TOPOLOGY_REFRESH_PERIOD = Duration.ofMinutes(1);
  private static final Duration MIN_EVICTABLE_IDLE = Duration.ofMinutes(1);

  private final ApplicationProperties properties;

  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    int threads = Runtime.getRuntime().availableProcessors();
    return DefaultClientResources.builder()
        .ioThreadPoolSize(threads)
        .computationThreadPoolSize(threads)
        .build();
  }

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    RedisProperties.PoolProperties pool = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(pool.maxActive());
    config.setMaxIdle(pool.maxIdle());
    config.setMinIdle(pool.minIdle());
    config.setMaxWait(pool.maxWait());
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(pool.timeBetweenEvictionRuns());
    config.setMinEvictableIdleDuration(MIN_EVICTABLE_IDLE);
    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    RedisProperties redis = properties.redis();
    boolean cluster = "cluster".equalsIgnoreCase(redis.mode());

    LettuceClientConfiguration clientConfiguration =
        clientConfiguration(redis, cluster, clientResources, poolConfig);

    if (cluster) {
      RedisClusterConfiguration clusterConfig = new RedisClusterConfiguration();
      parseClusterNodes(redis.cluster().nodes()).forEach(clusterConfig::addClusterNode);
      clusterConfig.setMaxRedirects(redis.cluster().maxRedirects());
      if (hasPassword(redis)) {
        clusterConfig.setPassword(redis.password());
      }
      log.info("Session store uses Redis cluster {}", redis.cluster().nodes());
      return new LettuceConnectionFactory(clusterConfig, clientConfiguration);
    }

    RedisStandaloneConfiguration standaloneConfig =
        new RedisStandaloneConfiguration(redis.host(), redis.port());
    if (hasPassword(redis)) {
      standaloneConfig.setPassword(redis.password());
    }
    log.info("Session store uses Redis at {}:{}", redis.host(), redis.port());
    return new LettuceConnectionFactory(standaloneConfig, clientConfiguration);
  }

  /**
   * Shared by the durable session store and the security event sink. Values are JSON strings.
   */
  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  /**
   * Parses {@code host:port[,host:port...]}.
   *
   * @throws IllegalStateException on an entry without a numeric port
   */
  static List<RedisNode> parseClusterNodes(String nodes) {
    List<RedisNode> parsed = new ArrayList<>();
    for (String node : nodes.split(",")) {
      String entry = node.trim();
      int colon = entry.lastIndexOf(':');
      if (colon <= 0 || colon == entry.length() - 1) {
        throw new IllegalStateException("Invalid Redis cluster node '" + entry + "', expected host:port");
      }
      try {
        parsed.add(new RedisNode(entry.substring(0, colon), Integer.parseInt(entry.substring(colon + 1))));
      } catch (NumberFormatException e) {
        throw new IllegalStateException("Invalid port in Redis cluster node '" + entry + "'", e);
      }
    }
    return parsed;
  }

  private LettuceClientConfiguration clientConfiguration(
      RedisProperties redis,
      boolean cluster,
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redis.timeout())
            .shutdownTimeout(SHUTDOWN_TIMEOUT)
            .clientOptions(cluster ? clusterClientOptions(redis) : clientOptions(redis));

    if (redis.ssl().enabled()) {
      builder.useSsl();
    }
    return builder.build();
  }

  private ClientOptions clientOptions(RedisProperties redis) {
    ClientOptions.Builder builder = ClientOptions.builder();
    applyCommonOptions(builder, redis);
    return builder.build();
  }

  private ClusterClientOptions clusterClientOptions(RedisProperties redis) {
    ClusterTopologyRefreshOptions refresh = ClusterTopologyRefreshOptions.builder()
        .enablePeriodicRefresh(TOPOLOGY_REFRESH_PERIOD)
        .enableAllAdaptiveRefreshTriggers()
        .closeStaleConnections(true)
        .build();

    ClusterClientOptions.Builder builder = ClusterClientOptions.builder()
        .topologyRefreshOptions(refresh)
        .maxRedirects(redis.cluster().maxRedirects());
    applyCommonOptions(builder, redis);
    return builder.build();
  }

  private void applyCommonOptions(ClientOptions.Builder builder, RedisProperties redis) {
    builder
        .socketOptions(SocketOptions.builder()
                           .connectTimeout(redis.timeout())
                           .keepAlive(true)
                           .tcpNoDelay(true)
                           .build())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .timeoutOptions(TimeoutOptions.enabled(redis.timeout()));
    if (redis.ssl().enabled()) {
      builder.sslOptions(SslOptions.builder().jdkSslProvider().build());
    }
  }

  private static boolean hasPassword(RedisProperties redis) {
    return redis.password() != null && !redis.password().isBlank();
  }
}
