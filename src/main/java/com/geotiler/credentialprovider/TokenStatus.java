package com.geotiler.credentialprovider;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of one scope's cache entry, for health reporting.
 *
 * @param secondsRemaining seconds until expiry, floored at zero; null when no token is cached
 * @param source credential source of the cached token; null when no token is cached
 */
public record TokenStatus(
    String scopeName,
    boolean hasToken,
    Long secondsRemaining,
    Instant expiresAt,
    String source,
    String lastError,
    Instant lastErrorTime,
    Instant lastSuccessTime) {

  public boolean hasError() {
    return lastError != null;
  }

  /**
   * Flat JSON-friendly view, timestamps as ISO-8601 strings.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("scope", scopeName);
    map.put("has_token", hasToken);
    map.put("ttl_seconds", secondsRemaining);
    map.put("expires_at", expiresAt == null ? null : expiresAt.toString());
    map.put("source", source);
    map.put("last_error", lastError);
    map.put("last_error_time", lastErrorTime == null ? null : lastErrorTime.toString());
    map.put("last_success_time", lastSuccessTime == null ? null : lastSuccessTime.toString());
    return map;
  }
}
