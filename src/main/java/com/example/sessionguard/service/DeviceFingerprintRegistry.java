package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.DeviceFingerprint;
import com.example.sessionguard.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Client-reported fingerprints keyed by device id. Entries outlive no session that could refer
 * to them: they expire after the extended session timeout without access.
 */
@Component
public class DeviceFingerprintRegistry {

  private final Cache<String, DeviceFingerprint> fingerprints;

  public DeviceFingerprintRegistry(ApplicationProperties properties) {
    this.fingerprints = Caffeine.newBuilder()
        .maximumSize(properties.cache().session().maxSize())
        .expireAfterAccess(properties.session().extendedSessionTimeout())
        .build();
  }

  public void register(String deviceId, DeviceFingerprint fingerprint) {
    fingerprints.put(deviceId, fingerprint);
  }

  public Optional<DeviceFingerprint> find(String deviceId) {
    return Optional.ofNullable(fingerprints.getIfPresent(deviceId));
  }
}
