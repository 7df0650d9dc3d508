package com.geotiler.credentialprovider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only table of the token scopes this process knows about.
 * <p>
 * Asking for a scope that was never defined is a programming error and fails immediately.
 */
public final class ScopeRegistry {
  public static final String STORAGE_ACCESS = "storage-access";
  public static final String DATABASE_ACCESS = "database-access";

  public static final String STORAGE_AUDIENCE = "https://storage.azure.com/.default";
  public static final String DATABASE_AUDIENCE = "https://ossrdbms-aad.database.windows.net/.default";

  /**
   * GDAL reads the account from {@code AZURE_STORAGE_ACCOUNT}; fsspec/adlfs reads
   * {@code AZURE_STORAGE_ACCOUNT_NAME}.
   */
  public static final List<String> STORAGE_ACCOUNT_VARIABLES =
      List.of("AZURE_STORAGE_ACCOUNT", "AZURE_STORAGE_ACCOUNT_NAME");
  public static final String STORAGE_ACCESS_TOKEN_VARIABLE = "AZURE_STORAGE_ACCESS_TOKEN";
  public static final String STORAGE_SAS_TOKEN_VARIABLE = "AZURE_STORAGE_SAS_TOKEN";

  private static final Duration ENTRA_TOKEN_LIFETIME = Duration.ofHours(1);

  private final Map<String, ScopeDefinition> scopes;

  public ScopeRegistry(Collection<ScopeDefinition> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    Map<String, ScopeDefinition> byName = new LinkedHashMap<>();
    for (ScopeDefinition definition : definitions) {
      Objects.requireNonNull(definition, "definition");
      if (byName.putIfAbsent(definition.name(), definition) != null) {
        throw new IllegalArgumentException("Duplicate token scope: " + definition.name());
      }
    }
    this.scopes = Collections.unmodifiableMap(byName);
  }

  /**
   * The two scopes the tile server needs: blob storage for GDAL and the PostgreSQL login.
   */
  public static ScopeRegistry defaults(CredentialProviderOptions options) {
    Objects.requireNonNull(options, "options");
    return new ScopeRegistry(List.of(
        new ScopeDefinition(
            STORAGE_ACCESS,
            STORAGE_AUDIENCE,
            ENTRA_TOKEN_LIFETIME,
            options.refreshThreshold(),
            PublishTarget.environment(
                STORAGE_ACCOUNT_VARIABLES,
                STORAGE_ACCESS_TOKEN_VARIABLE,
                STORAGE_SAS_TOKEN_VARIABLE)),
        new ScopeDefinition(
            DATABASE_ACCESS,
            DATABASE_AUDIENCE,
            ENTRA_TOKEN_LIFETIME,
            options.refreshThreshold(),
            PublishTarget.connectionString())));
  }

  public static ScopeRegistry defaults() {
    return defaults(new CredentialProviderOptions());
  }

  /**
   * Returns the definition for {@code name}.
   *
   * @throws IllegalArgumentException if no such scope was defined
   */
  public ScopeDefinition require(String name) {
    Objects.requireNonNull(name, "name");
    ScopeDefinition definition = scopes.get(name);
    if (definition == null) {
      throw new IllegalArgumentException("Unknown token scope: " + name + " (known: " + scopes.keySet() + ")");
    }
    return definition;
  }

  public Collection<ScopeDefinition> all() {
    return scopes.values();
  }

  /**
   * Scopes whose tokens are published to environment variables, i.e. the ones worth refreshing
   * in the background.
   */
  public List<ScopeDefinition> environmentScopes() {
    List<ScopeDefinition> result = new ArrayList<>();
    for (ScopeDefinition definition : scopes.values()) {
      if (definition.publishTarget().isEnvironment()) {
        result.add(definition);
      }
    }
    return List.copyOf(result);
  }
}
