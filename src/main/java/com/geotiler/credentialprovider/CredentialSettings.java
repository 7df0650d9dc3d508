package com.geotiler.credentialprovider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Startup configuration of the credential subsystem.
 * <p>
 * Values come from an optional JSON file and are overridden by environment variables:
 * <ul>
 *   <li>{@code DEPLOYMENT_MODE} ({@code local}/{@code platform}) or {@code LOCAL_MODE} (true/false)</li>
 *   <li>{@code USE_AZURE_AUTH}, {@code AZURE_STORAGE_ACCOUNT}, {@code AZURE_STORAGE_ACCESS_KEY} (local only)</li>
 *   <li>{@code AZURE_TENANT_ID}, {@code MANAGED_IDENTITY_CLIENT_ID}</li>
 *   <li>{@code POSTGRES_HOST}, {@code POSTGRES_PORT}, {@code POSTGRES_DB}, {@code POSTGRES_USER},
 *       {@code POSTGRES_AUTH_MODE}, {@code POSTGRES_PASSWORD}, {@code POSTGRES_SEARCH_PATH}</li>
 *   <li>{@code KEY_VAULT_NAME}, {@code KEY_VAULT_SECRET_NAME} (PostgreSQL key vault mode)</li>
 *   <li>{@code PORT}</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CredentialSettings {
  @JsonProperty("deploymentMode")
  private String deploymentMode = "local";

  @JsonProperty("useAzureAuth")
  private boolean useAzureAuth = true;

  @JsonProperty("storageAccount")
  private String storageAccount;

  @JsonProperty("storageAccountKey")
  private String storageAccountKey;

  @JsonProperty("tenantId")
  private String tenantId;

  @JsonProperty("managedIdentityClientId")
  private String managedIdentityClientId;

  @JsonProperty("port")
  private int port = 8000;

  @JsonProperty("database")
  private DatabaseSection database = new DatabaseSection();

  public static CredentialSettings load(Path path, Map<String, String> environment) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(environment, "environment");

    if (!Files.exists(path)) {
      throw new IllegalStateException("Config file not found: " + path.toAbsolutePath());
    }

    ObjectMapper mapper = new ObjectMapper();
    CredentialSettings settings = mapper.readValue(Files.readString(path), CredentialSettings.class);
    if (settings.database == null) {
      settings.database = new DatabaseSection();
    }
    settings.applyEnvironment(environment);
    return settings;
  }

  public static CredentialSettings fromEnvironment(Map<String, String> environment) {
    Objects.requireNonNull(environment, "environment");
    CredentialSettings settings = new CredentialSettings();
    settings.applyEnvironment(environment);
    return settings;
  }

  private void applyEnvironment(Map<String, String> env) {
    String localMode = env.get("LOCAL_MODE");
    if (localMode != null) {
      deploymentMode = parseBoolean("LOCAL_MODE", localMode) ? "local" : "platform";
    }
    deploymentMode = env.getOrDefault("DEPLOYMENT_MODE", deploymentMode);

    String useAuth = env.get("USE_AZURE_AUTH");
    if (useAuth != null) {
      useAzureAuth = parseBoolean("USE_AZURE_AUTH", useAuth);
    }
    storageAccount = env.getOrDefault("AZURE_STORAGE_ACCOUNT", storageAccount);
    storageAccountKey = env.getOrDefault("AZURE_STORAGE_ACCESS_KEY", storageAccountKey);
    tenantId = env.getOrDefault("AZURE_TENANT_ID", tenantId);
    managedIdentityClientId = env.getOrDefault("MANAGED_IDENTITY_CLIENT_ID", managedIdentityClientId);
    if (env.containsKey("PORT")) {
      port = parseInt("PORT", env.get("PORT"));
    }

    database.host = env.getOrDefault("POSTGRES_HOST", database.host);
    database.name = env.getOrDefault("POSTGRES_DB", database.name);
    database.user = env.getOrDefault("POSTGRES_USER", database.user);
    database.authMode = env.getOrDefault("POSTGRES_AUTH_MODE", database.authMode);
    database.password = env.getOrDefault("POSTGRES_PASSWORD", database.password);
    database.searchPath = env.getOrDefault("POSTGRES_SEARCH_PATH", database.searchPath);
    database.keyVaultName = env.getOrDefault("KEY_VAULT_NAME", database.keyVaultName);
    database.keyVaultSecretName = env.getOrDefault("KEY_VAULT_SECRET_NAME", database.keyVaultSecretName);
    if (env.containsKey("POSTGRES_PORT")) {
      database.port = parseInt("POSTGRES_PORT", env.get("POSTGRES_PORT"));
    }
  }

  /**
   * Rejects combinations the subsystem must never run with.
   *
   * @throws IllegalStateException on invalid configuration
   */
  public CredentialSettings validate() {
    DeploymentMode mode = deploymentMode();
    if (mode == DeploymentMode.PLATFORM && !isBlank(storageAccountKey)) {
      throw new IllegalStateException(
          "A storage account key must not be configured in platform mode; the managed identity is used instead.");
    }
    if (!isBlank(storageAccountKey) && isBlank(storageAccount)) {
      throw new IllegalStateException("A storage account key was configured without AZURE_STORAGE_ACCOUNT.");
    }
    if (useAzureAuth && isBlank(storageAccount)) {
      throw new IllegalStateException("AZURE_STORAGE_ACCOUNT must be set when Azure storage auth is enabled.");
    }
    if (hasDatabaseConfig()) {
      try {
        databaseSettings();
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException("Invalid PostgreSQL configuration: " + e.getMessage(), e);
      }
    }
    return this;
  }

  public DeploymentMode deploymentMode() {
    return DeploymentMode.parse(deploymentMode);
  }

  public boolean useAzureAuth() {
    return useAzureAuth;
  }

  public String storageAccount() {
    return storageAccount;
  }

  /**
   * Raw account key for the local signed fallback. Only ever handed to the credential chain.
   */
  String storageAccountKey() {
    return storageAccountKey;
  }

  public boolean hasStorageAccountKey() {
    return !isBlank(storageAccountKey);
  }

  public String tenantId() {
    return tenantId;
  }

  public String managedIdentityClientId() {
    return managedIdentityClientId;
  }

  public int port() {
    return port;
  }

  public boolean hasDatabaseConfig() {
    return !isBlank(database.host) && !isBlank(database.name) && !isBlank(database.user);
  }

  /**
   * @throws IllegalStateException if the PostgreSQL host, database or user is missing
   */
  public DatabaseConnectionSettings databaseSettings() {
    if (!hasDatabaseConfig()) {
      throw new IllegalStateException("PostgreSQL host, database and user must all be configured.");
    }
    return new DatabaseConnectionSettings(
        database.host,
        database.port,
        database.name,
        database.user,
        DatabaseAuthMode.parse(database.authMode),
        database.password,
        database.searchPath,
        database.sslMode,
        database.keyVaultName,
        database.keyVaultSecretName);
  }

  @Override
  public String toString() {
    return "CredentialSettings{mode=" + deploymentMode
        + ", useAzureAuth=" + useAzureAuth
        + ", storageAccount=" + storageAccount
        + ", storageAccountKey=" + (isBlank(storageAccountKey) ? "<none>" : "<set>")
        + ", tenantId=" + tenantId
        + ", managedIdentityClientId=" + managedIdentityClientId
        + "}";
  }

  private static boolean parseBoolean(String name, String value) {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true":
      case "1":
      case "yes":
        return true;
      case "false":
      case "0":
      case "no":
        return false;
      default:
        throw new IllegalArgumentException(name + " must be true/false, 1/0 or yes/no, got: " + value);
    }
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class DatabaseSection {
    @JsonProperty("host")
    private String host;

    @JsonProperty("port")
    private int port = DatabaseConnectionSettings.DEFAULT_PORT;

    @JsonProperty("name")
    private String name;

    @JsonProperty("user")
    private String user;

    @JsonProperty("authMode")
    private String authMode = "token";

    @JsonProperty("password")
    private String password;

    @JsonProperty("searchPath")
    private String searchPath;

    @JsonProperty("sslMode")
    private String sslMode;

    @JsonProperty("keyVaultName")
    private String keyVaultName;

    @JsonProperty("keyVaultSecretName")
    private String keyVaultSecretName;
  }
}
