package com.geotiler.credentialprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.security.keyvault.secrets.SecretClient;
import com.azure.security.keyvault.secrets.SecretClientBuilder;
import com.azure.security.keyvault.secrets.models.KeyVaultSecret;
import java.util.Objects;

/**
 * Reads secrets from Azure Key Vault with the process identity.
 */
public final class KeyVaultSecretSource implements DatabaseSecretSource {
  private final String vaultName;
  private final SecretClient client;

  KeyVaultSecretSource(String vaultName, SecretClient client) {
    this.vaultName = Objects.requireNonNull(vaultName, "vaultName");
    this.client = Objects.requireNonNull(client, "client");
  }

  public static KeyVaultSecretSource create(String vaultName, TokenCredential credential) {
    Objects.requireNonNull(credential, "credential");
    SecretClient client = new SecretClientBuilder()
        .vaultUrl(vaultUrl(vaultName))
        .credential(credential)
        .buildClient();
    return new KeyVaultSecretSource(vaultName, client);
  }

  static String vaultUrl(String vaultName) {
    Objects.requireNonNull(vaultName, "vaultName");
    if (vaultName.isBlank() || !vaultName.matches("[A-Za-z0-9-]+")) {
      throw new IllegalArgumentException("Invalid Key Vault name: " + vaultName);
    }
    return "https://" + vaultName + ".vault.azure.net/";
  }

  @Override
  public String getSecret(String secretName) {
    Objects.requireNonNull(secretName, "secretName");
    KeyVaultSecret secret = client.getSecret(secretName);
    if (secret == null || secret.getValue() == null) {
      throw new IllegalStateException("Key Vault " + vaultName + " returned no value for secret " + secretName);
    }
    return secret.getValue();
  }

  @Override
  public String toString() {
    return "KeyVaultSecretSource{" + vaultName + "}";
  }
}
