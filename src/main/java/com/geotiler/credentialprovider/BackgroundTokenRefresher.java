package com.geotiler.credentialprovider;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proactively refreshes and republishes environment-published tokens on a fixed delay, so that
 * requests rarely hit the refresh path themselves.
 * <p>
 * A failed refresh is logged and leaves the previous publication in place.
 */
public final class BackgroundTokenRefresher implements AutoCloseable {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(BackgroundTokenRefresher.class);

  private final TokenCache cache;
  private final CredentialPublisher publisher;
  private final List<ScopeDefinition> scopes;
  private final Duration interval;
  private final Logger logger;
  private final ScheduledExecutorService executor;

  public BackgroundTokenRefresher(
      TokenCache cache,
      CredentialPublisher publisher,
      List<ScopeDefinition> scopes,
      Duration interval) {
    this(cache, publisher, scopes, interval, DEFAULT_LOGGER);
  }

  public BackgroundTokenRefresher(
      TokenCache cache,
      CredentialPublisher publisher,
      List<ScopeDefinition> scopes,
      Duration interval,
      Logger logger) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.scopes = List.copyOf(Objects.requireNonNull(scopes, "scopes"));
    this.interval = Objects.requireNonNull(interval, "interval");
    this.logger = Objects.requireNonNull(logger, "logger");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    for (ScopeDefinition scope : this.scopes) {
      if (!scope.publishTarget().isEnvironment()) {
        throw new IllegalArgumentException("Scope " + scope.name() + " is not republished after startup");
      }
    }
    this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "token-refresh");
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Runs one round on the calling thread, so tokens are published before the server accepts
   * traffic, then schedules the following rounds. Failures in the first round are logged like any
   * other round.
   */
  public void start() {
    refreshAll();
    long millis = interval.toMillis();
    executor.scheduleWithFixedDelay(this::refreshAll, millis, millis, TimeUnit.MILLISECONDS);
    logger.info("Background token refresh started ({}-minute interval, scopes {})",
        interval.toMinutes(), scopeNames());
  }

  /**
   * One refresh round over every scope.
   */
  public void refreshAll() {
    logger.debug("Background token refresh triggered");
    for (ScopeDefinition scope : scopes) {
      try {
        TokenRecord token = cache.refresh(scope.name());
        publisher.publish(scope, token);
      } catch (TokenAcquisitionException e) {
        logger.error("Background refresh of {} failed ({}); the previously published token stays in place",
            scope.name(), e.reason(), e);
      } catch (RuntimeException e) {
        // Escaping the scheduled task would cancel every later round.
        logger.error("Background refresh of {} failed unexpectedly; the previously published token stays in place",
            scope.name(), e);
      }
    }
    logger.debug("Background refresh complete, next in {}m", interval.toMinutes());
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private List<String> scopeNames() {
    return scopes.stream().map(ScopeDefinition::name).toList();
  }
}
