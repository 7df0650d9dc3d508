package com.geotiler.credentialprovider;

import java.util.Locale;
import java.util.Objects;

/**
 * How the PostgreSQL login password is obtained.
 */
public enum DatabaseAuthMode {
  /** Entra ID access token for the database scope, used as the password. */
  TOKEN,

  /** Static password from configuration. */
  PASSWORD,

  /** Password stored as an Azure Key Vault secret, read with the process identity. */
  KEY_VAULT;

  public static DatabaseAuthMode parse(String value) {
    Objects.requireNonNull(value, "value");
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "token":
      case "managed_identity":
      case "managed-identity":
        return TOKEN;
      case "password":
        return PASSWORD;
      case "key_vault":
      case "key-vault":
        return KEY_VAULT;
      default:
        throw new IllegalArgumentException(
            "Unknown database auth mode: " + value + " (expected token, password or key_vault)");
    }
  }
}
