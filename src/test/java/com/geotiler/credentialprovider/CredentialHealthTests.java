package com.geotiler.credentialprovider;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

public class CredentialHealthTests {
  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private final TestClock clock = TestClock.fixedUtc(T0);
  private final AtomicBoolean databaseConnected = new AtomicBoolean(true);

  @Test
  void notReady_beforeFirstToken() {
    CredentialHealth health = health(new FakeCredentialSource("fake"));

    assertFalse(health.ready());
    assertFalse(health.storageToken().hasToken());
  }

  @Test
  void ready_whileTokenHasMarginAndPoolIsConnected() {
    FakeCredentialSource source = new FakeCredentialSource("fake")
        .thenGrant(new AccessGrant("t1", TokenKind.BEARER, T0.plusSeconds(3600)));
    TokenCache cache = cache(source);
    CredentialHealth health = new CredentialHealth(
        cache, ScopeRegistry.STORAGE_ACCESS, databaseConnected::get, Duration.ofSeconds(60));

    cache.getToken(ScopeRegistry.STORAGE_ACCESS);
    assertTrue(health.ready());

    databaseConnected.set(false);
    assertFalse(health.ready());
    databaseConnected.set(true);

    clock.advanceSeconds(3541);
    assertFalse(health.ready(), "59 seconds left is below the readiness margin");
  }

  @SuppressWarnings("unchecked")
  @Test
  void report_exposesTokenFactsWithoutValue() {
    FakeCredentialSource source = new FakeCredentialSource("managed-identity")
        .thenGrant(new AccessGrant("secret-token", TokenKind.BEARER, T0.plusSeconds(3600)));
    TokenCache cache = cache(source);
    CredentialHealth health = new CredentialHealth(
        cache, ScopeRegistry.STORAGE_ACCESS, databaseConnected::get, Duration.ofSeconds(60));
    cache.getToken(ScopeRegistry.STORAGE_ACCESS);
    clock.advanceSeconds(600);

    Map<String, Object> report = health.report();

    assertEquals(true, report.get("ready"));
    assertEquals(true, report.get("database_connected"));
    Map<String, Object> token = (Map<String, Object>) report.get("storage_token");
    assertEquals(true, token.get("has_token"));
    assertEquals(3000L, token.get("ttl_seconds"));
    assertEquals("2026-01-01T01:00:00Z", token.get("expires_at"));
    assertEquals("managed-identity", token.get("source"));
    assertNull(token.get("last_error"));
    assertFalse(report.toString().contains("secret-token"));
  }

  @Test
  void unknownStorageScope_isRejected() {
    TokenCache cache = cache(new FakeCredentialSource("fake"));

    assertThrows(IllegalArgumentException.class, () -> new CredentialHealth(
        cache, "blob", databaseConnected::get, Duration.ofSeconds(60)));
  }

  private CredentialHealth health(FakeCredentialSource source) {
    return new CredentialHealth(
        cache(source), ScopeRegistry.STORAGE_ACCESS, databaseConnected::get, Duration.ofSeconds(60));
  }

  private TokenCache cache(FakeCredentialSource source) {
    TokenAcquirer acquirer = new TokenAcquirer(
        TestChains.of(DeploymentMode.PLATFORM, source),
        clock,
        LoggerFactory.getLogger(TokenAcquirer.class));
    return new TokenCache(ScopeRegistry.defaults(), acquirer, clock, LoggerFactory.getLogger(TokenCache.class));
  }
}
