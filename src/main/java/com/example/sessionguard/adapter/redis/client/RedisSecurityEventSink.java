package com.example.sessionguard.adapter.redis.client;

import com.example.sessionguard.adapter.events.SecurityEventSink;
import com.example.sessionguard.domain.entity.SecurityEvent;
import com.example.sessionguard.exception.SessionPersistenceException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Appends security events to a capped Redis list, newest first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSecurityEventSink implements SecurityEventSink {

  public static final String SECURITY_EVENTS_KEY = "security_events";

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;

  @Override
  public void append(SecurityEvent event) {
    String json;
    try {
      json = objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new SessionPersistenceException("Failed to serialize security event " + event.type(), e);
    }

    redisTemplate.opsForList().leftPush(SECURITY_EVENTS_KEY, json);
    redisTemplate.opsForList().trim(SECURITY_EVENTS_KEY, 0,
                                    properties.persistence().securityEventLogSize() - 1L);
    log.trace("Appended security event {} for user {}", event.type().value(), event.userId());
  }
}
