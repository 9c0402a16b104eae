package com.example.sessionguard.adapter.geo;

import com.example.sessionguard.domain.entity.SessionLocation;
import java.util.Optional;

/**
 * Resolves an approximate location for a client address. Best-effort: an empty result is normal.
 */
public interface LocationResolver {

  Optional<SessionLocation> resolve(String ipAddress);
}
