package com.example.sessionguard.adapter.events;

import com.example.sessionguard.domain.entity.SecurityEvent;

/**
 * Destination of the security event log.
 */
public interface SecurityEventSink {

  void append(SecurityEvent event);
}
