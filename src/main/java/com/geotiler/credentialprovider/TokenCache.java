package com.geotiler.credentialprovider;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process cache of the current token for each registered scope.
 * <p>
 * Design intent:
 * <ul>
 *   <li>Hot path: a fresh cached token is returned with a single volatile read, no lock and no
 *       identity call.</li>
 *   <li>Refresh path: single flight per scope. The scope's monitor is held for the whole
 *       acquisition, so concurrent callers that all see a stale token wait for the one in-flight
 *       acquisition and then get its result. Unrelated scopes never contend.</li>
 *   <li>A failed acquisition never replaces the cached record; the failure propagates.</li>
 * </ul>
 */
public final class TokenCache {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(TokenCache.class);

  private final ScopeRegistry registry;
  private final TokenAcquirer acquirer;
  private final Clock clock;
  private final Logger logger;

  private final Map<String, ScopeSlot> slots;

  public TokenCache(ScopeRegistry registry, TokenAcquirer acquirer) {
    this(registry, acquirer, Clock.systemUTC(), DEFAULT_LOGGER);
  }

  public TokenCache(ScopeRegistry registry, TokenAcquirer acquirer, Clock clock, Logger logger) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.acquirer = Objects.requireNonNull(acquirer, "acquirer");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.logger = Objects.requireNonNull(logger, "logger");

    Map<String, ScopeSlot> byName = new LinkedHashMap<>();
    for (ScopeDefinition scope : registry.all()) {
      byName.put(scope.name(), new ScopeSlot(scope));
    }
    this.slots = Collections.unmodifiableMap(byName);
  }

  /**
   * Returns a token for {@code scopeName} that is valid now, acquiring one if the cached token is
   * missing or within the scope's refresh threshold.
   *
   * @throws IllegalArgumentException if the scope is not registered
   * @throws TokenAcquisitionException if a refresh was needed and failed
   */
  public String getToken(String scopeName) {
    return getRecord(scopeName).value();
  }

  /**
   * Same as {@link #getToken(String)} but returns the whole record.
   */
  public TokenRecord getRecord(String scopeName) {
    ScopeSlot slot = slot(scopeName);

    TokenRecord current = slot.current;
    if (isServable(slot, current)) {
      return current;
    }

    synchronized (slot) {
      current = slot.current;
      if (isServable(slot, current)) {
        return current;
      }
      return acquireLocked(slot, current == null ? "cold start" : "stale token");
    }
  }

  /**
   * Acquires a new token for {@code scopeName} regardless of the cached one. Waits behind any
   * acquisition already in flight for that scope.
   */
  public TokenRecord refresh(String scopeName) {
    ScopeSlot slot = slot(scopeName);
    synchronized (slot) {
      return acquireLocked(slot, "forced");
    }
  }

  /**
   * Marks the cached token stale so the next {@link #getRecord} acquires a new one. The record is
   * kept for status reporting.
   */
  public void invalidate(String scopeName) {
    ScopeSlot slot = slot(scopeName);
    // Under the monitor so an acquisition already in flight cannot clear the flag afterwards.
    synchronized (slot) {
      slot.invalidated = true;
    }
    logger.debug("{} token invalidated", scopeName);
  }

  /**
   * Snapshot for health reporting. Never blocks on an in-flight acquisition.
   */
  public TokenStatus status(String scopeName) {
    ScopeSlot slot = slot(scopeName);
    TokenRecord current = slot.current;
    ErrorState errors = slot.errors;
    if (current == null) {
      return new TokenStatus(
          scopeName, false, null, null, null, errors.lastError, errors.lastErrorTime, errors.lastSuccessTime);
    }

    long remaining = Math.max(0L, current.remainingAt(Instant.now(clock)).getSeconds());
    return new TokenStatus(
        scopeName,
        true,
        remaining,
        current.expiresAt(),
        current.source(),
        errors.lastError,
        errors.lastErrorTime,
        errors.lastSuccessTime);
  }

  public ScopeRegistry registry() {
    return registry;
  }

  private boolean isServable(ScopeSlot slot, TokenRecord current) {
    return current != null
        && !slot.invalidated
        && current.isFreshAt(Instant.now(clock), slot.scope.refreshThreshold());
  }

  // Caller holds the slot monitor.
  private TokenRecord acquireLocked(ScopeSlot slot, String trigger) {
    logger.debug("Acquiring {} token ({})", slot.scope.name(), trigger);

    TokenRecord acquired;
    try {
      acquired = acquirer.acquire(slot.scope);
    } catch (RuntimeException e) {
      Instant now = Instant.now(clock);
      slot.errors = slot.errors.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), now);

      TokenRecord previous = slot.current;
      if (previous != null && previous.isValidAt(now)) {
        logger.warn("{} token refresh failed; previous token from {} remains valid until {}",
            slot.scope.name(), previous.source(), previous.expiresAt());
      }
      throw e;
    }

    slot.current = acquired;
    slot.invalidated = false;
    slot.errors = slot.errors.succeeded(acquired.issuedAt());
    return acquired;
  }

  private ScopeSlot slot(String scopeName) {
    Objects.requireNonNull(scopeName, "scopeName");
    ScopeSlot slot = slots.get(scopeName);
    if (slot == null) {
      // Delegates to the registry for the fail-fast message.
      registry.require(scopeName);
      throw new IllegalArgumentException("Unknown token scope: " + scopeName);
    }
    return slot;
  }

  private static final class ScopeSlot {
    private final ScopeDefinition scope;
    private volatile TokenRecord current;
    private volatile boolean invalidated;
    private volatile ErrorState errors = ErrorState.NONE;

    private ScopeSlot(ScopeDefinition scope) {
      this.scope = scope;
    }
  }

  private static final class ErrorState {
    private static final ErrorState NONE = new ErrorState(null, null, null);

    private final String lastError;
    private final Instant lastErrorTime;
    private final Instant lastSuccessTime;

    private ErrorState(String lastError, Instant lastErrorTime, Instant lastSuccessTime) {
      this.lastError = lastError;
      this.lastErrorTime = lastErrorTime;
      this.lastSuccessTime = lastSuccessTime;
    }

    ErrorState failed(String error, Instant at) {
      return new ErrorState(error, at, lastSuccessTime);
    }

    ErrorState succeeded(Instant at) {
      return new ErrorState(null, lastErrorTime, at);
    }
  }
}
