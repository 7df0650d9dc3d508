package com.geotiler.credentialprovider;

import java.util.List;
import java.util.Objects;

/**
 * Where a resolved token for a scope has to become visible.
 *
 * @param kind environment variables, or a connection string built once at startup
 * @param accountVariables variables that carry the storage account name alongside the token
 * @param bearerVariable variable that carries a bearer token
 * @param sasVariable variable that carries a shared access signature
 */
public record PublishTarget(
    Kind kind,
    List<String> accountVariables,
    String bearerVariable,
    String sasVariable) {

  public enum Kind {
    ENVIRONMENT,
    CONNECTION_STRING
  }

  public PublishTarget {
    Objects.requireNonNull(kind, "kind");
    accountVariables = (accountVariables == null) ? List.of() : List.copyOf(accountVariables);
    if (kind == Kind.ENVIRONMENT) {
      Objects.requireNonNull(bearerVariable, "bearerVariable");
      Objects.requireNonNull(sasVariable, "sasVariable");
      if (bearerVariable.equals(sasVariable)) {
        throw new IllegalArgumentException("bearerVariable and sasVariable must differ");
      }
    }
  }

  public static PublishTarget environment(
      List<String> accountVariables,
      String bearerVariable,
      String sasVariable) {
    return new PublishTarget(Kind.ENVIRONMENT, accountVariables, bearerVariable, sasVariable);
  }

  public static PublishTarget connectionString() {
    return new PublishTarget(Kind.CONNECTION_STRING, List.of(), null, null);
  }

  public boolean isEnvironment() {
    return kind == Kind.ENVIRONMENT;
  }

  /**
   * Returns the variable a token of the given kind is written to.
   */
  public String variableFor(TokenKind tokenKind) {
    Objects.requireNonNull(tokenKind, "tokenKind");
    if (!isEnvironment()) {
      throw new IllegalStateException("Connection-string targets have no token variable.");
    }
    return tokenKind == TokenKind.BEARER ? bearerVariable : sasVariable;
  }
}
