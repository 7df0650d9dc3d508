package com.geotiler.credentialprovider;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The most recent token obtained for a scope.
 * <p>
 * {@code expiresAt} is always the expiry carried by the issued token. The value is left out of
 * {@link #toString()}.
 */
public final class TokenRecord {
  private final String scopeName;
  private final String value;
  private final TokenKind kind;
  private final Instant issuedAt;
  private final Instant expiresAt;
  private final String source;

  public TokenRecord(
      String scopeName,
      String value,
      TokenKind kind,
      Instant issuedAt,
      Instant expiresAt,
      String source) {
    this.scopeName = Objects.requireNonNull(scopeName, "scopeName");
    this.value = Objects.requireNonNull(value, "value");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
    this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    this.source = Objects.requireNonNull(source, "source");
    if (value.isBlank()) {
      throw new IllegalArgumentException("value must be non-blank");
    }
  }

  public String scopeName() {
    return scopeName;
  }

  public String value() {
    return value;
  }

  public TokenKind kind() {
    return kind;
  }

  public Instant issuedAt() {
    return issuedAt;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  /**
   * Name of the credential source that produced this token.
   */
  public String source() {
    return source;
  }

  public boolean isValidAt(Instant now) {
    return now.isBefore(expiresAt);
  }

  /**
   * True while the token is more than {@code refreshThreshold} away from expiry.
   */
  public boolean isFreshAt(Instant now, Duration refreshThreshold) {
    return now.isBefore(expiresAt.minus(refreshThreshold));
  }

  public Duration remainingAt(Instant now) {
    return Duration.between(now, expiresAt);
  }

  @Override
  public String toString() {
    return "TokenRecord{scope=" + scopeName
        + ", kind=" + kind
        + ", source=" + source
        + ", issuedAt=" + issuedAt
        + ", expiresAt=" + expiresAt
        + ", length=" + value.length()
        + "}";
  }
}
