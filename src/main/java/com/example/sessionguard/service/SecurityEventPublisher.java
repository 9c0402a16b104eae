package com.example.sessionguard.service;

import com.example.sessionguard.adapter.events.SecurityEventSink;
import com.example.sessionguard.domain.entity.SecurityEvent;
import com.example.sessionguard.domain.entity.SecurityEventType;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget delivery of security events. Sink failures are logged, never propagated.
 */
@Slf4j
@Service
public class SecurityEventPublisher {

  private final SecurityEventSink sink;
  private final Executor executor;
  private final Clock clock;

  public SecurityEventPublisher(
      SecurityEventSink sink,
      @Qualifier("sessionWriteBehindExecutor") Executor executor,
      Clock clock) {
    this.sink = sink;
    this.executor = executor;
    this.clock = clock;
  }

  public void publish(String userId, SecurityEventType type, Map<String, Object> metadata) {
    SecurityEvent event = new SecurityEvent(userId, type, clock.instant(), Map.copyOf(metadata));
    try {
      executor.execute(() -> deliver(event));
    } catch (RejectedExecutionException e) {
      log.warn("Dropped security event {} for user {}: executor saturated", type.value(), userId);
    }
  }

  private void deliver(SecurityEvent event) {
    try {
      sink.append(event);
    } catch (RuntimeException e) {
      log.warn("Failed to log security event {} for user {}", event.type().value(), event.userId(), e);
    }
  }
}
