package com.geotiler.credentialprovider;

/**
 * Makes a resolved token visible to the consumer of its scope.
 */
public interface CredentialPublisher {
  void publish(ScopeDefinition scope, TokenRecord token);
}
