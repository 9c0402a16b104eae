package com.example.sessionguard.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-user critical sections for operations that must see all of a user's sessions at once,
 * such as capacity enforcement followed by an insert. Locks are reentrant and held in a
 * weak-valued map, so idle users cost nothing.
 */
@Slf4j
@Service
public class UserSessionLockService {

  private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
      .weakValues()
      .build(userId -> new ReentrantLock());

  public <T> T withUserLock(String userId, Supplier<T> action) {
    ReentrantLock lock = locks.get(userId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
