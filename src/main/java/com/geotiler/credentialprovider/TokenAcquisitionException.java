package com.geotiler.credentialprovider;

import java.util.Objects;

/**
 * Raised when no token could be obtained for a scope.
 */
public final class TokenAcquisitionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public enum Reason {
    /** The credential source could not even attempt acquisition (no CLI login, no managed identity, no key). */
    IDENTITY_UNAVAILABLE,

    /** Network failure, timeout or a throttled/unavailable identity endpoint. The next attempt may succeed. */
    TRANSIENT,

    /** The identity provider refused. Usually a missing role assignment; retrying will not help. */
    DENIED
  }

  private final String scopeName;
  private final Reason reason;

  public TokenAcquisitionException(String scopeName, Reason reason, String message) {
    this(scopeName, reason, message, null);
  }

  public TokenAcquisitionException(String scopeName, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.scopeName = Objects.requireNonNull(scopeName, "scopeName");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public String scopeName() {
    return scopeName;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isRetryable() {
    return reason == Reason.TRANSIENT;
  }
}
