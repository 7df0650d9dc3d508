package com.geotiler.credentialprovider;

import java.util.Objects;

/**
 * Where and as whom to connect to PostgreSQL. The password, if any, is left out of
 * {@link #toString()}.
 */
public final class DatabaseConnectionSettings {
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_SSL_MODE = "require";
  public static final String DEFAULT_KEY_VAULT_SECRET_NAME = "postgres-password";

  private final String host;
  private final int port;
  private final String database;
  private final String user;
  private final DatabaseAuthMode authMode;
  private final String password;
  private final String searchPath;
  private final String sslMode;
  private final String keyVaultName;
  private final String keyVaultSecretName;

  public DatabaseConnectionSettings(
      String host,
      int port,
      String database,
      String user,
      DatabaseAuthMode authMode,
      String password,
      String searchPath,
      String sslMode) {
    this(host, port, database, user, authMode, password, searchPath, sslMode, null, null);
  }

  public DatabaseConnectionSettings(
      String host,
      int port,
      String database,
      String user,
      DatabaseAuthMode authMode,
      String password,
      String searchPath,
      String sslMode,
      String keyVaultName,
      String keyVaultSecretName) {
    this.host = requireNonBlank(host, "host");
    this.database = requireNonBlank(database, "database");
    this.user = requireNonBlank(user, "user");
    this.authMode = Objects.requireNonNull(authMode, "authMode");
    this.searchPath = normalizeOptional(searchPath);
    this.sslMode = (sslMode == null || sslMode.isBlank()) ? DEFAULT_SSL_MODE : sslMode;
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    this.port = port;

    if (authMode == DatabaseAuthMode.PASSWORD) {
      if (password == null || password.isBlank()) {
        throw new IllegalArgumentException("password is required in password mode");
      }
      this.password = password;
    } else {
      // Token and vault modes never take a password from configuration.
      if (password != null && !password.isBlank()) {
        throw new IllegalArgumentException("password must not be set in " + authMode + " mode");
      }
      this.password = null;
    }

    if (authMode == DatabaseAuthMode.KEY_VAULT) {
      if (keyVaultName == null || keyVaultName.isBlank()) {
        throw new IllegalArgumentException("keyVaultName is required in key vault mode");
      }
      this.keyVaultName = keyVaultName;
      this.keyVaultSecretName = (keyVaultSecretName == null || keyVaultSecretName.isBlank())
          ? DEFAULT_KEY_VAULT_SECRET_NAME
          : keyVaultSecretName;
    } else {
      this.keyVaultName = null;
      this.keyVaultSecretName = null;
    }
  }

  public static DatabaseConnectionSettings forToken(String host, int port, String database, String user, String searchPath) {
    return new DatabaseConnectionSettings(host, port, database, user, DatabaseAuthMode.TOKEN, null, searchPath, null);
  }

  public static DatabaseConnectionSettings forPassword(
      String host,
      int port,
      String database,
      String user,
      String password,
      String searchPath) {
    return new DatabaseConnectionSettings(
        host, port, database, user, DatabaseAuthMode.PASSWORD, password, searchPath, null);
  }

  public static DatabaseConnectionSettings forKeyVault(
      String host,
      int port,
      String database,
      String user,
      String keyVaultName,
      String keyVaultSecretName,
      String searchPath) {
    return new DatabaseConnectionSettings(
        host, port, database, user, DatabaseAuthMode.KEY_VAULT, null, searchPath, null,
        keyVaultName, keyVaultSecretName);
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String database() {
    return database;
  }

  public String user() {
    return user;
  }

  public DatabaseAuthMode authMode() {
    return authMode;
  }

  /**
   * Static password; null in token mode.
   */
  String password() {
    return password;
  }

  /**
   * Comma-separated schema list, e.g. {@code pgstac,geo,public}; null when not set.
   */
  public String searchPath() {
    return searchPath;
  }

  public String sslMode() {
    return sslMode;
  }

  /**
   * Vault holding the password; null unless the mode is {@link DatabaseAuthMode#KEY_VAULT}.
   */
  public String keyVaultName() {
    return keyVaultName;
  }

  public String keyVaultSecretName() {
    return keyVaultSecretName;
  }

  @Override
  public String toString() {
    return "DatabaseConnectionSettings{" + user + "@" + host + ":" + port + "/" + database
        + ", authMode=" + authMode + ", sslMode=" + sslMode
        + (keyVaultName == null ? "" : ", keyVault=" + keyVaultName + "/" + keyVaultSecretName)
        + "}";
  }

  private static String requireNonBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must be non-blank");
    }
    return value;
  }

  private static String normalizeOptional(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value;
  }
}
