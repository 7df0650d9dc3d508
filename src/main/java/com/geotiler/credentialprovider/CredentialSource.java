package com.geotiler.credentialprovider;

/**
 * One entry of a credential chain.
 * <p>
 * Implementations block until a token is issued or acquisition fails. They never cache; that is
 * {@link TokenCache}'s job.
 */
public interface CredentialSource {
  /**
   * Short diagnostic name, recorded as the source of every token this entry produces.
   */
  String name();

  /**
   * Whether this entry can issue tokens for {@code scope} at all. Unsupported scopes are skipped
   * without an attempt.
   */
  default boolean supports(ScopeDefinition scope) {
    return true;
  }

  /**
   * Acquires a token for {@code scope}.
   *
   * @throws TokenAcquisitionException when no token could be issued
   */
  AccessGrant acquire(ScopeDefinition scope);
}
