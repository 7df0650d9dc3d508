package com.geotiler.credentialprovider.harness;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geotiler.credentialprovider.BackgroundTokenRefresher;
import com.geotiler.credentialprovider.ConnectionStringBuilder;
import com.geotiler.credentialprovider.CredentialChain;
import com.geotiler.credentialprovider.CredentialChains;
import com.geotiler.credentialprovider.CredentialHealth;
import com.geotiler.credentialprovider.CredentialProviderOptions;
import com.geotiler.credentialprovider.CredentialSettings;
import com.geotiler.credentialprovider.DatabaseAuthMode;
import com.geotiler.credentialprovider.DatabaseConnectionSettings;
import com.geotiler.credentialprovider.DatabaseSecretSource;
import com.geotiler.credentialprovider.EnvironmentPublisher;
import com.geotiler.credentialprovider.KeyVaultSecretSource;
import com.geotiler.credentialprovider.ScopeDefinition;
import com.geotiler.credentialprovider.ScopeRegistry;
import com.geotiler.credentialprovider.StorageAuthFilter;
import com.geotiler.credentialprovider.TokenAcquirer;
import com.geotiler.credentialprovider.TokenCache;
import com.geotiler.credentialprovider.VariableStore;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the credential subsystem into a small HTTP server the way the tile server does:
 * PostgreSQL connection built once at startup, storage token published before every storage
 * request, background refresh, and a health endpoint.
 * <p>
 * Tile rendering itself is not here; {@code /storage/} stands in for it and reports which storage
 * variables a native reader would see (names only).
 */
public final class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static void main(String[] args) {
    try {
      CredentialSettings settings = loadSettings(args).validate();
      LOGGER.info("Settings: {}", settings);

      CredentialProviderOptions options = new CredentialProviderOptions();
      Clock clock = Clock.systemUTC();
      ScopeRegistry registry = ScopeRegistry.defaults(options);

      CredentialChain chain = CredentialChains.resolve(settings, options, clock);
      LOGGER.info("Credential chain: {}", chain);

      TokenAcquirer acquirer = new TokenAcquirer(chain, clock, LoggerFactory.getLogger(TokenAcquirer.class));
      TokenCache cache = new TokenCache(registry, acquirer, clock, LoggerFactory.getLogger(TokenCache.class));

      AtomicBoolean poolConnected = new AtomicBoolean(!settings.hasDatabaseConfig());
      if (settings.hasDatabaseConfig()) {
        DatabaseConnectionSettings database = settings.databaseSettings();
        DatabaseSecretSource secrets = database.authMode() == DatabaseAuthMode.KEY_VAULT
            ? KeyVaultSecretSource.create(database.keyVaultName(), chain.identityCredential())
            : null;
        ConnectionStringBuilder connectionStrings = new ConnectionStringBuilder(
            database,
            acquirer,
            secrets,
            registry.require(ScopeRegistry.DATABASE_ACCESS),
            LoggerFactory.getLogger(ConnectionStringBuilder.class));
        // No driver ships with the harness; a real deployment creates its pool here.
        connectionStrings.initializePool(jdbcUrl -> poolConnected.set(true));
      } else {
        LOGGER.info("No PostgreSQL configuration; skipping database connection.");
      }

      Map<String, String> nativeEnvironment = new ProcessBuilder().environment();
      VariableStore store = VariableStore.of(nativeEnvironment);

      HttpServer server = HttpServer.create(new InetSocketAddress(settings.port()), 0);
      server.setExecutor(Executors.newFixedThreadPool(16));

      BackgroundTokenRefresher refresher = null;
      HttpContext storageContext = server.createContext("/storage/", exchange -> describeStorage(exchange, store));

      if (settings.useAzureAuth()) {
        ScopeDefinition storageScope = registry.require(ScopeRegistry.STORAGE_ACCESS);
        EnvironmentPublisher publisher = new EnvironmentPublisher(store, settings.storageAccount());
        storageContext.getFilters().add(new StorageAuthFilter(cache, publisher, storageScope));

        refresher = new BackgroundTokenRefresher(
            cache,
            publisher,
            registry.environmentScopes(),
            options.backgroundRefreshInterval());
        // Publishes the first storage token before the server starts taking requests.
        refresher.start();
      } else {
        LOGGER.info("Azure storage authentication is disabled");
      }

      CredentialHealth health = new CredentialHealth(
          cache,
          ScopeRegistry.STORAGE_ACCESS,
          poolConnected::get,
          options.readinessMinTtl());
      server.createContext("/livez", exchange -> write(exchange, 200, "text/plain", "ok"));
      server.createContext("/health", exchange -> writeJson(exchange, 200, health.report()));
      server.createContext("/readyz", exchange -> {
        boolean ready = health.ready();
        writeJson(exchange, ready ? 200 : 503, Map.of("ready", ready));
      });

      BackgroundTokenRefresher refresherToClose = refresher;
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        LOGGER.info("Shutting down");
        if (refresherToClose != null) {
          refresherToClose.close();
        }
        server.stop(0);
      }, "shutdown"));

      server.start();
      LOGGER.info("Listening on port {}", server.getAddress().getPort());
    } catch (Exception ex) {
      LOGGER.error("Startup failed", ex);
      System.exit(1);
    }
  }

  private static CredentialSettings loadSettings(String[] args) throws IOException {
    if (args == null || args.length == 0) {
      return CredentialSettings.fromEnvironment(System.getenv());
    }

    if (args.length == 2 && "--config".equals(args[0])) {
      return CredentialSettings.load(Path.of(args[1]), System.getenv());
    }

    throw new IllegalArgumentException("Usage: Main [--config <path-to-config.json>]");
  }

  private static void describeStorage(HttpExchange exchange, VariableStore store) throws IOException {
    Map<String, Object> visible = new LinkedHashMap<>();
    synchronized (store) {
      for (String name : ScopeRegistry.STORAGE_ACCOUNT_VARIABLES) {
        visible.put(name, store.get(name));
      }
      visible.put(ScopeRegistry.STORAGE_ACCESS_TOKEN_VARIABLE, store.get(ScopeRegistry.STORAGE_ACCESS_TOKEN_VARIABLE) != null);
      visible.put(ScopeRegistry.STORAGE_SAS_TOKEN_VARIABLE, store.get(ScopeRegistry.STORAGE_SAS_TOKEN_VARIABLE) != null);
      for (String name : EnvironmentPublisher.RAW_SECRET_VARIABLES) {
        visible.put(name, store.get(name) != null);
      }
    }
    writeJson(exchange, 200, visible);
  }

  private static void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
    write(exchange, status, "application/json", MAPPER.writeValueAsString(body));
  }

  private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", contentType);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
