package com.geotiler.credentialprovider;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Facts an external health endpoint reports: the storage token countdown and source, and whether
 * the database pool says it is connected.
 */
public final class CredentialHealth {
  private final TokenCache cache;
  private final String storageScope;
  private final BooleanSupplier databaseConnected;
  private final Duration readinessMinTtl;

  public CredentialHealth(
      TokenCache cache,
      String storageScope,
      BooleanSupplier databaseConnected,
      Duration readinessMinTtl) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.storageScope = Objects.requireNonNull(storageScope, "storageScope");
    this.databaseConnected = Objects.requireNonNull(databaseConnected, "databaseConnected");
    this.readinessMinTtl = Objects.requireNonNull(readinessMinTtl, "readinessMinTtl");
    cache.registry().require(storageScope);
  }

  public TokenStatus storageToken() {
    return cache.status(storageScope);
  }

  public boolean databaseConnected() {
    return databaseConnected.getAsBoolean();
  }

  /**
   * Ready when a storage token is cached with at least the readiness margin left and the pool is
   * connected.
   */
  public boolean ready() {
    TokenStatus status = storageToken();
    return status.hasToken()
        && status.secondsRemaining() >= readinessMinTtl.getSeconds()
        && databaseConnected();
  }

  public Map<String, Object> report() {
    Map<String, Object> report = new LinkedHashMap<>();
    report.put("ready", ready());
    report.put("storage_token", storageToken().toMap());
    report.put("database_connected", databaseConnected());
    return report;
  }
}
