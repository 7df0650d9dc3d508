package com.geotiler.credentialprovider;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable description of one logical token scope.
 * <p>
 * {@code nominalTtl} is what the issuer usually grants. It is only used for diagnostics: the expiry
 * of a cached token always comes from the token itself.
 */
public final class ScopeDefinition {
  private final String name;
  private final String audience;
  private final Duration nominalTtl;
  private final Duration refreshThreshold;
  private final PublishTarget publishTarget;

  public ScopeDefinition(
      String name,
      String audience,
      Duration nominalTtl,
      Duration refreshThreshold,
      PublishTarget publishTarget) {
    this.name = requireNonBlank(name, "name");
    this.audience = requireNonBlank(audience, "audience");
    this.nominalTtl = Objects.requireNonNull(nominalTtl, "nominalTtl");
    this.refreshThreshold = Objects.requireNonNull(refreshThreshold, "refreshThreshold");
    this.publishTarget = Objects.requireNonNull(publishTarget, "publishTarget");
    if (nominalTtl.isNegative() || nominalTtl.isZero()) {
      throw new IllegalArgumentException("nominalTtl must be positive");
    }
    if (refreshThreshold.isNegative()) {
      throw new IllegalArgumentException("refreshThreshold must be non-negative");
    }
  }

  public String name() {
    return name;
  }

  /**
   * The identity-provider resource the token is requested for, e.g.
   * {@code https://storage.azure.com/.default}.
   */
  public String audience() {
    return audience;
  }

  public Duration nominalTtl() {
    return nominalTtl;
  }

  /**
   * How long before expiry a cached token stops being served from the cache.
   */
  public Duration refreshThreshold() {
    return refreshThreshold;
  }

  public PublishTarget publishTarget() {
    return publishTarget;
  }

  @Override
  public String toString() {
    return "ScopeDefinition{name=" + name + ", audience=" + audience + ", target=" + publishTarget.kind() + "}";
  }

  private static String requireNonBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must be non-blank");
    }
    return value;
  }
}
