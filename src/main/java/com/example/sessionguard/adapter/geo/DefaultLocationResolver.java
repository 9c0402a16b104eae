package com.example.sessionguard.adapter.geo;

import com.example.sessionguard.domain.entity.SessionLocation;
import java.time.ZoneId;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Placeholder resolver until a geolocation provider is wired in. Reports an unknown place in
 * the server's time zone.
 */
@Component
public class DefaultLocationResolver implements LocationResolver {

  private static final String UNKNOWN = "Unknown";

  @Override
  public Optional<SessionLocation> resolve(String ipAddress) {
    return Optional.of(new SessionLocation(UNKNOWN, UNKNOWN, ZoneId.systemDefault().getId()));
  }
}
