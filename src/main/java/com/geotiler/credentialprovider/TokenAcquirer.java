package com.geotiler.credentialprovider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains a token for a scope by walking the process credential chain.
 * <p>
 * Rules:
 * <ul>
 *   <li>Sources that do not support the scope are skipped.</li>
 *   <li>A source reporting {@code IDENTITY_UNAVAILABLE} is skipped and the next one is tried.</li>
 *   <li>{@code TRANSIENT} and {@code DENIED} failures end the walk and propagate as-is, so a
 *       missing role assignment is never hidden behind a fallback.</li>
 *   <li>When every source is unavailable the call fails with all attempts attached as suppressed
 *       exceptions.</li>
 * </ul>
 */
public final class TokenAcquirer {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(TokenAcquirer.class);

  private final CredentialChain chain;
  private final Clock clock;
  private final Logger logger;

  public TokenAcquirer(CredentialChain chain) {
    this(chain, Clock.systemUTC(), DEFAULT_LOGGER);
  }

  public TokenAcquirer(CredentialChain chain, Clock clock, Logger logger) {
    this.chain = Objects.requireNonNull(chain, "chain");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  public CredentialChain chain() {
    return chain;
  }

  /**
   * Acquires a new token for {@code scope}. Blocks for the duration of the identity call.
   *
   * @throws TokenAcquisitionException if no source in the chain produced a token
   */
  public TokenRecord acquire(ScopeDefinition scope) {
    Objects.requireNonNull(scope, "scope");

    List<TokenAcquisitionException> unavailable = new ArrayList<>();
    for (CredentialSource source : chain.sources()) {
      if (!source.supports(scope)) {
        logger.debug("Credential source {} does not support scope {}; skipping", source.name(), scope.name());
        continue;
      }

      AccessGrant grant;
      try {
        grant = source.acquire(scope);
      } catch (TokenAcquisitionException e) {
        if (e.reason() != TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE) {
          logFailure(scope, e);
          throw e;
        }
        logger.warn("Credential source {} unavailable for {}: {}", source.name(), scope.name(), e.getMessage());
        unavailable.add(e);
        continue;
      }

      return toRecord(scope, source, grant);
    }

    TokenAcquisitionException failure = new TokenAcquisitionException(
        scope.name(),
        TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE,
        "No credential source in the " + chain.name() + " chain could issue a token for " + scope.name());
    for (TokenAcquisitionException attempt : unavailable) {
      failure.addSuppressed(attempt);
    }
    logFailure(scope, failure);
    throw failure;
  }

  private TokenRecord toRecord(ScopeDefinition scope, CredentialSource source, AccessGrant grant) {
    Instant now = Instant.now(clock);
    if (!grant.expiresAt().isAfter(now)) {
      TokenAcquisitionException expired = new TokenAcquisitionException(
          scope.name(),
          TokenAcquisitionException.Reason.TRANSIENT,
          source.name() + " issued a " + scope.name() + " token that already expired at " + grant.expiresAt());
      logFailure(scope, expired);
      throw expired;
    }

    Duration lifetime = Duration.between(now, grant.expiresAt());
    if (lifetime.compareTo(scope.refreshThreshold()) <= 0) {
      logger.warn(
          "{} token from {} lives {}s, inside the {}s refresh threshold; every request will refresh it",
          scope.name(), source.name(), lifetime.toSeconds(), scope.refreshThreshold().toSeconds());
    } else if (lifetime.compareTo(scope.nominalTtl()) < 0) {
      logger.debug("{} token from {} lives {}s (nominal {}s)",
          scope.name(), source.name(), lifetime.toSeconds(), scope.nominalTtl().toSeconds());
    }

    TokenRecord record = new TokenRecord(
        scope.name(),
        grant.value(),
        grant.kind(),
        now,
        grant.expiresAt(),
        source.name());
    logger.info("{} token acquired from {}, expires={}", scope.name(), source.name(), grant.expiresAt());
    return record;
  }

  private void logFailure(ScopeDefinition scope, TokenAcquisitionException e) {
    logger.error("{} token acquisition failed ({}): {}", scope.name(), e.reason(), e.getMessage());
    if (chain.mode() == DeploymentMode.LOCAL) {
      logger.error("Troubleshooting: run 'az login' and verify with 'az account show'");
    } else if (e.reason() == TokenAcquisitionException.Reason.DENIED) {
      logger.error("Troubleshooting: verify the managed identity holds a role on the target resource "
          + "(Storage Blob Data Reader for storage, a matching database user for PostgreSQL)");
    } else {
      logger.error("Troubleshooting: verify a managed identity is assigned to the host");
    }
  }
}
