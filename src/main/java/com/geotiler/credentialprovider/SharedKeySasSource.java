package com.geotiler.credentialprovider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Development fallback that derives a short-lived account SAS from a locally held storage account
 * key. No network call is made.
 * <p>
 * The key stays inside this object: it has no accessor, is left out of {@link #toString()}, and
 * only the derived SAS is ever returned.
 */
public final class SharedKeySasSource implements CredentialSource {
  public static final String NAME = "shared-key-sas";

  private final String accountName;
  private final String base64AccountKey;
  private final Duration lifetime;
  private final Clock clock;

  public SharedKeySasSource(String accountName, String base64AccountKey, Duration lifetime, Clock clock) {
    this.accountName = requireNonBlank(accountName, "accountName");
    this.base64AccountKey = requireValidKey(base64AccountKey);
    this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (lifetime.isNegative() || lifetime.isZero()) {
      throw new IllegalArgumentException("lifetime must be positive");
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  /**
   * A storage account key only grants storage access, and the derived SAS is only understood by
   * consumers reading environment variables.
   */
  @Override
  public boolean supports(ScopeDefinition scope) {
    return scope.publishTarget().isEnvironment()
        && ScopeRegistry.STORAGE_AUDIENCE.equals(scope.audience());
  }

  @Override
  public AccessGrant acquire(ScopeDefinition scope) {
    Objects.requireNonNull(scope, "scope");
    if (!supports(scope)) {
      throw new TokenAcquisitionException(
          scope.name(),
          TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE,
          "A storage account key cannot issue tokens for " + scope.name());
    }

    Instant expiresAt = SharedKeySasSigner.signedExpiry(clock.instant().plus(lifetime));
    String sas = SharedKeySasSigner.generateAccountSas(accountName, base64AccountKey, expiresAt);
    return new AccessGrant(sas, TokenKind.SHARED_ACCESS_SIGNATURE, expiresAt);
  }

  @Override
  public String toString() {
    return "SharedKeySasSource{account=" + accountName + ", lifetime=" + lifetime + "}";
  }

  private static String requireValidKey(String base64AccountKey) {
    requireNonBlank(base64AccountKey, "base64AccountKey");
    byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(base64AccountKey);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("base64AccountKey is not valid base64", e);
    }
    boolean empty = decoded.length == 0;
    Arrays.fill(decoded, (byte) 0);
    if (empty) {
      throw new IllegalArgumentException("base64AccountKey decodes to an empty key");
    }
    return base64AccountKey;
  }

  private static String requireNonBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must be non-blank");
    }
    return value;
  }
}
