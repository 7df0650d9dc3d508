package com.geotiler.credentialprovider;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes storage tokens into the variables GDAL and fsspec read on every blob open.
 * <p>
 * Every publication also removes the raw storage secret variables, whether or not anything
 * should have set them. No account key is ever visible next to a published token.
 */
public final class EnvironmentPublisher implements CredentialPublisher {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(EnvironmentPublisher.class);

  /**
   * Variables through which a native storage client would pick up a long-lived secret.
   */
  public static final List<String> RAW_SECRET_VARIABLES = List.of(
      "AZURE_STORAGE_ACCESS_KEY",
      "AZURE_STORAGE_KEY",
      "AZURE_STORAGE_CONNECTION_STRING");

  private final VariableStore store;
  private final String accountName;
  private final Logger logger;

  public EnvironmentPublisher(VariableStore store, String accountName) {
    this(store, accountName, DEFAULT_LOGGER);
  }

  public EnvironmentPublisher(VariableStore store, String accountName, Logger logger) {
    this.store = Objects.requireNonNull(store, "store");
    this.accountName = requireNonBlank(accountName, "accountName");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void publish(ScopeDefinition scope, TokenRecord token) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(token, "token");

    PublishTarget target = scope.publishTarget();
    if (!target.isEnvironment()) {
      throw new IllegalArgumentException("Scope " + scope.name() + " is not published to environment variables");
    }
    if (!scope.name().equals(token.scopeName())) {
      throw new IllegalArgumentException(
          "Token for scope " + token.scopeName() + " cannot be published as " + scope.name());
    }

    String tokenVariable = target.variableFor(token.kind());
    String otherVariable = target.variableFor(otherKind(token.kind()));

    synchronized (store) {
      for (String accountVariable : target.accountVariables()) {
        store.set(accountVariable, accountName);
      }
      store.set(tokenVariable, token.value());
      store.remove(otherVariable);
      removeRawSecrets();
    }

    logger.debug("Published {} {} token to {} (length {} chars, expires {})",
        scope.name(), token.kind(), tokenVariable, token.value().length(), token.expiresAt());
  }

  // Caller holds the store monitor.
  private void removeRawSecrets() {
    for (String variable : RAW_SECRET_VARIABLES) {
      if (store.get(variable) != null) {
        logger.warn("Removed raw storage secret variable {} before exposing token credentials", variable);
      }
      store.remove(variable);
    }
  }

  private static TokenKind otherKind(TokenKind kind) {
    return kind == TokenKind.BEARER ? TokenKind.SHARED_ACCESS_SIGNATURE : TokenKind.BEARER;
  }

  private static String requireNonBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must be non-blank");
    }
    return value;
  }
}
