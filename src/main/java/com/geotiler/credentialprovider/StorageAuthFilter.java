package com.geotiler.credentialprovider;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-request hook that puts a fresh storage token in place before the request reaches tile
 * rendering.
 * <p>
 * If the token cannot be obtained the failure is logged and the request still proceeds: the
 * storage client then reports its own authentication error. This filter never changes the
 * response status.
 */
public final class StorageAuthFilter extends Filter {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(StorageAuthFilter.class);

  /**
   * Paths that never read from storage.
   */
  public static final List<String> SKIP_PREFIXES = List.of(
      "/livez",
      "/readyz",
      "/health",
      "/static/",
      "/docs",
      "/redoc",
      "/openapi.json",
      "/api",
      "/_health-fragment");

  private final TokenCache cache;
  private final CredentialPublisher publisher;
  private final ScopeDefinition scope;
  private final Logger logger;

  public StorageAuthFilter(TokenCache cache, CredentialPublisher publisher, ScopeDefinition scope) {
    this(cache, publisher, scope, DEFAULT_LOGGER);
  }

  public StorageAuthFilter(TokenCache cache, CredentialPublisher publisher, ScopeDefinition scope, Logger logger) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
    String path = exchange.getRequestURI().getPath();
    if (!skipsAuth(path)) {
      ensureCredentials();
    }
    chain.doFilter(exchange);
  }

  @Override
  public String description() {
    return "Publishes a valid " + scope.name() + " token before each storage request";
  }

  static boolean skipsAuth(String path) {
    if (path == null) {
      return false;
    }
    for (String prefix : SKIP_PREFIXES) {
      if (path.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  void ensureCredentials() {
    try {
      TokenRecord token = cache.getRecord(scope.name());
      publisher.publish(scope, token);
      logger.debug("Storage auth configured, token length: {} chars", token.value().length());
    } catch (TokenAcquisitionException e) {
      logger.error("No valid {} token for this request ({}); continuing so the storage client reports its own error",
          scope.name(), e.reason(), e);
    } catch (RuntimeException e) {
      logger.error("Unexpected failure configuring {} credentials; continuing without them", scope.name(), e);
    }
  }
}
