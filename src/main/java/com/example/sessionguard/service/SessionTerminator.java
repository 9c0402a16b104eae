package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.SessionRecord;
import com.example.sessionguard.domain.entity.TerminationReason;

@FunctionalInterface
public interface SessionTerminator {

  void terminate(SessionRecord session, TerminationReason reason);
}
