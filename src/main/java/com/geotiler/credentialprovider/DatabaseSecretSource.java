package com.geotiler.credentialprovider;

/**
 * Looks up a named secret, such as the PostgreSQL password kept in a vault.
 */
@FunctionalInterface
public interface DatabaseSecretSource {
  /**
   * @return the secret value; never null
   * @throws RuntimeException if the secret cannot be read
   */
  String getSecret(String secretName);
}
