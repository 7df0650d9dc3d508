package com.geotiler.credentialprovider;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the PostgreSQL JDBC URL once at startup and hands it to the pool initializer.
 * <p>
 * In token mode the database-scope token is acquired once, straight from the credential chain,
 * and used as the password. In key vault mode the password is read once from the vault secret.
 * The URL is not kept: after the pool exists the driver manages its own
 * connections, and the token expires within the hour anyway. Any failure here is fatal for
 * startup.
 */
public final class ConnectionStringBuilder {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(ConnectionStringBuilder.class);

  private final DatabaseConnectionSettings settings;
  private final TokenAcquirer acquirer;
  private final DatabaseSecretSource secrets;
  private final ScopeDefinition scope;
  private final Logger logger;

  private final AtomicBoolean initialized = new AtomicBoolean();

  public ConnectionStringBuilder(DatabaseConnectionSettings settings, TokenAcquirer acquirer, ScopeDefinition scope) {
    this(settings, acquirer, null, scope, DEFAULT_LOGGER);
  }

  public ConnectionStringBuilder(
      DatabaseConnectionSettings settings,
      TokenAcquirer acquirer,
      ScopeDefinition scope,
      Logger logger) {
    this(settings, acquirer, null, scope, logger);
  }

  /**
   * @param acquirer required in token mode
   * @param secrets required in key vault mode
   */
  public ConnectionStringBuilder(
      DatabaseConnectionSettings settings,
      TokenAcquirer acquirer,
      DatabaseSecretSource secrets,
      ScopeDefinition scope,
      Logger logger) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.logger = Objects.requireNonNull(logger, "logger");
    this.acquirer = settings.authMode() == DatabaseAuthMode.TOKEN
        ? Objects.requireNonNull(acquirer, "acquirer")
        : acquirer;
    this.secrets = settings.authMode() == DatabaseAuthMode.KEY_VAULT
        ? Objects.requireNonNull(secrets, "secrets")
        : secrets;
    if (scope.publishTarget().isEnvironment()) {
      throw new IllegalArgumentException("Scope " + scope.name() + " is not a connection-string scope");
    }
  }

  /**
   * Resolves the password, builds the URL and calls {@code initializer} with it. Runs once.
   *
   * @throws IllegalStateException if called twice or if the database credential cannot be obtained
   */
  public void initializePool(ConnectionPoolInitializer initializer) {
    Objects.requireNonNull(initializer, "initializer");
    if (!initialized.compareAndSet(false, true)) {
      throw new IllegalStateException("Database connection pool was already initialized.");
    }

    logger.info("Building PostgreSQL connection for {}", settings);
    String password = resolvePassword();
    initializer.initialize(buildJdbcUrl(settings, password));
    logger.info("PostgreSQL connection pool initialized ({} auth)", settings.authMode());
  }

  private String resolvePassword() {
    if (settings.authMode() == DatabaseAuthMode.PASSWORD) {
      logger.info("Using PostgreSQL password from configuration");
      return settings.password();
    }
    if (settings.authMode() == DatabaseAuthMode.KEY_VAULT) {
      return passwordFromVault();
    }

    try {
      TokenRecord token = acquirer.acquire(scope);
      logger.info("PostgreSQL token acquired from {}, expires {}", token.source(), token.expiresAt());
      return token.value();
    } catch (TokenAcquisitionException e) {
      throw new IllegalStateException(
          "Cannot start without a " + scope.name() + " token (" + e.reason() + "): " + e.getMessage(), e);
    }
  }

  private String passwordFromVault() {
    logger.info("Retrieving PostgreSQL password from Key Vault {} (secret {})",
        settings.keyVaultName(), settings.keyVaultSecretName());
    String password;
    try {
      password = secrets.getSecret(settings.keyVaultSecretName());
    } catch (RuntimeException e) {
      throw new IllegalStateException(
          "Cannot read PostgreSQL password from Key Vault " + settings.keyVaultName() + ": " + e.getMessage(), e);
    }
    if (password == null || password.isBlank()) {
      throw new IllegalStateException(
          "Key Vault secret " + settings.keyVaultSecretName() + " in " + settings.keyVaultName() + " is empty");
    }
    logger.debug("Key Vault password length: {} chars", password.length());
    return password;
  }

  /**
   * Formats the JDBC URL, URL-encoding user, password and the optional {@code search_path}.
   */
  public static String buildJdbcUrl(DatabaseConnectionSettings settings, String password) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(password, "password");

    StringBuilder url = new StringBuilder()
        .append("jdbc:postgresql://")
        .append(settings.host())
        .append(':')
        .append(settings.port())
        .append('/')
        .append(encode(settings.database()))
        .append("?sslmode=").append(encode(settings.sslMode()))
        .append("&user=").append(encode(settings.user()))
        .append("&password=").append(encode(password));

    if (settings.searchPath() != null) {
      url.append("&options=").append(encode("-c search_path=" + settings.searchPath()));
    }
    return url.toString();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
