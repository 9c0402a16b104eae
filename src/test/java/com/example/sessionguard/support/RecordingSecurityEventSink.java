package com.example.sessionguard.support;

import com.example.sessionguard.adapter.events.SecurityEventSink;
import com.example.sessionguard.domain.entity.SecurityEvent;
import com.example.sessionguard.domain.entity.SecurityEventType;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingSecurityEventSink implements SecurityEventSink {

  private final List<SecurityEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void append(SecurityEvent event) {
    events.add(event);
  }

  public List<SecurityEvent> events() {
    return List.copyOf(events);
  }

  public List<SecurityEvent> ofType(SecurityEventType type) {
    return events.stream().filter(event -> event.type() == type).toList();
  }

  public void clear() {
    events.clear();
  }
}
