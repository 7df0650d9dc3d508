package com.geotiler.credentialprovider;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing policy shared by the cache, the background refresher and the health surface.
 */
public final class CredentialProviderOptions {
  public static final Duration DEFAULT_REFRESH_THRESHOLD = Duration.ofMinutes(5);
  public static final Duration DEFAULT_BACKGROUND_REFRESH_INTERVAL = Duration.ofMinutes(45);
  public static final Duration DEFAULT_READINESS_MIN_TTL = Duration.ofMinutes(1);
  public static final Duration DEFAULT_SHARED_KEY_SAS_LIFETIME = Duration.ofHours(1);

  private final Duration refreshThreshold;
  private final Duration backgroundRefreshInterval;
  private final Duration readinessMinTtl;
  private final Duration sharedKeySasLifetime;

  public CredentialProviderOptions() {
    this(
        DEFAULT_REFRESH_THRESHOLD,
        DEFAULT_BACKGROUND_REFRESH_INTERVAL,
        DEFAULT_READINESS_MIN_TTL,
        DEFAULT_SHARED_KEY_SAS_LIFETIME);
  }

  public CredentialProviderOptions(
      Duration refreshThreshold,
      Duration backgroundRefreshInterval,
      Duration readinessMinTtl,
      Duration sharedKeySasLifetime) {
    this.refreshThreshold = Objects.requireNonNull(refreshThreshold, "refreshThreshold");
    this.backgroundRefreshInterval = Objects.requireNonNull(backgroundRefreshInterval, "backgroundRefreshInterval");
    this.readinessMinTtl = Objects.requireNonNull(readinessMinTtl, "readinessMinTtl");
    this.sharedKeySasLifetime = Objects.requireNonNull(sharedKeySasLifetime, "sharedKeySasLifetime");
    if (refreshThreshold.isNegative()) {
      throw new IllegalArgumentException("refreshThreshold must be non-negative");
    }
    if (readinessMinTtl.isNegative()) {
      throw new IllegalArgumentException("readinessMinTtl must be non-negative");
    }
    if (backgroundRefreshInterval.isNegative() || backgroundRefreshInterval.isZero()) {
      throw new IllegalArgumentException("backgroundRefreshInterval must be positive");
    }
    // A SAS that expires inside the refresh window would be stale the moment it is signed.
    if (sharedKeySasLifetime.compareTo(refreshThreshold) <= 0) {
      throw new IllegalArgumentException("sharedKeySasLifetime must be longer than refreshThreshold");
    }
  }

  public Duration refreshThreshold() {
    return refreshThreshold;
  }

  public Duration backgroundRefreshInterval() {
    return backgroundRefreshInterval;
  }

  public Duration readinessMinTtl() {
    return readinessMinTtl;
  }

  public Duration sharedKeySasLifetime() {
    return sharedKeySasLifetime;
  }
}
