package com.geotiler.credentialprovider;

import java.time.Instant;
import java.util.Objects;

/**
 * A token as handed back by a credential source, with the expiry the issuer put on it.
 */
public record AccessGrant(String value, TokenKind kind, Instant expiresAt) {
  public AccessGrant {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(expiresAt, "expiresAt");
    if (value.isBlank()) {
      throw new IllegalArgumentException("value must be non-blank");
    }
  }

  @Override
  public String toString() {
    return "AccessGrant{kind=" + kind + ", expiresAt=" + expiresAt + ", length=" + value.length() + "}";
  }
}
