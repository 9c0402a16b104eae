package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Threads and time for the session subsystem: a bounded write-behind pool for durable writes and
 * security events, a dedicated scheduler for the janitor, and the clock every component reads.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableScheduling
public class SchedulingConfig {

  public static final String WRITE_BEHIND_EXECUTOR = "sessionWriteBehindExecutor";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Bounded pool for fire-and-forget durable writes. When the queue is full, submissions are
   * rejected and the caller logs and drops the write; request threads never block on it.
   */
  @Bean(name = WRITE_BEHIND_EXECUTOR)
  public ThreadPoolTaskExecutor sessionWriteBehindExecutor(ApplicationProperties properties) {
    ApplicationProperties.PersistenceProperties persistence = properties.persistence();
    log.info("Configuring session write-behind executor: core={}, max={}, queue={}",
             persistence.corePoolSize(), persistence.maxPoolSize(), persistence.queueCapacity());

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(persistence.corePoolSize());
    executor.setMaxPoolSize(persistence.maxPoolSize());
    executor.setQueueCapacity(persistence.queueCapacity());
    executor.setThreadNamePrefix("session-write-behind-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    return executor;
  }

  /**
   * Runs @Scheduled tasks (the session janitor) on their own thread so they never compete with
   * the write-behind pool.
   */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("session-janitor-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }
}
