package com.geotiler.credentialprovider;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

public class TokenAcquirerTests {
  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private final TestClock clock = TestClock.fixedUtc(T0);
  private final ScopeRegistry registry = ScopeRegistry.defaults();
  private final ScopeDefinition storage = registry.require(ScopeRegistry.STORAGE_ACCESS);
  private final ScopeDefinition database = registry.require(ScopeRegistry.DATABASE_ACCESS);

  @Test
  void record_carriesExpiryFromGrant_andIssueTimeFromClock() {
    FakeCredentialSource source = new FakeCredentialSource("cli")
        .thenGrant(new AccessGrant("abc", TokenKind.BEARER, T0.plusSeconds(1234)));

    TokenRecord record = acquirer(DeploymentMode.LOCAL, source).acquire(storage);

    assertEquals(ScopeRegistry.STORAGE_ACCESS, record.scopeName());
    assertEquals("abc", record.value());
    assertEquals(TokenKind.BEARER, record.kind());
    assertEquals(T0, record.issuedAt());
    assertEquals(T0.plusSeconds(1234), record.expiresAt());
    assertEquals("cli", record.source());
    assertFalse(record.toString().contains("abc"), "token value must not be printed");
  }

  @Test
  void unavailableSource_fallsThroughToNext() {
    FakeCredentialSource first = new FakeCredentialSource("cli")
        .thenFail(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE);
    FakeCredentialSource second = new FakeCredentialSource("fallback")
        .thenGrant(new AccessGrant("sas", TokenKind.SHARED_ACCESS_SIGNATURE, T0.plusSeconds(3600)));

    TokenRecord record = acquirer(DeploymentMode.LOCAL, first, second).acquire(storage);

    assertEquals("fallback", record.source());
    assertEquals(TokenKind.SHARED_ACCESS_SIGNATURE, record.kind());
    assertEquals(1, first.calls());
    assertEquals(1, second.calls());
  }

  @Test
  void deniedSource_stopsTheWalk() {
    FakeCredentialSource first = new FakeCredentialSource("managed")
        .thenFail(TokenAcquisitionException.Reason.DENIED);
    FakeCredentialSource second = new FakeCredentialSource("never");

    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> acquirer(DeploymentMode.PLATFORM, first, second).acquire(storage));

    assertEquals(TokenAcquisitionException.Reason.DENIED, e.reason());
    assertFalse(e.isRetryable());
    assertEquals(0, second.calls());
  }

  @Test
  void transientFailure_stopsTheWalk() {
    FakeCredentialSource first = new FakeCredentialSource("cli")
        .thenFail(TokenAcquisitionException.Reason.TRANSIENT);
    FakeCredentialSource second = new FakeCredentialSource("never");

    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> acquirer(DeploymentMode.LOCAL, first, second).acquire(storage));

    assertEquals(TokenAcquisitionException.Reason.TRANSIENT, e.reason());
    assertTrue(e.isRetryable());
    assertEquals(0, second.calls());
  }

  @Test
  void allUnavailable_reportsEveryAttempt() {
    FakeCredentialSource first = new FakeCredentialSource("cli")
        .thenFail(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE);
    FakeCredentialSource second = new FakeCredentialSource("fallback")
        .thenFail(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE);

    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> acquirer(DeploymentMode.LOCAL, first, second).acquire(storage));

    assertEquals(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE, e.reason());
    assertEquals(ScopeRegistry.STORAGE_ACCESS, e.scopeName());
    assertEquals(2, e.getSuppressed().length);
  }

  @Test
  void unsupportedSource_isSkippedWithoutCall() {
    FakeCredentialSource unsupported = new FakeCredentialSource("other").supportingNothing();
    FakeCredentialSource supported = new FakeCredentialSource("cli")
        .thenGrant(new AccessGrant("abc", TokenKind.BEARER, T0.plusSeconds(3600)));

    TokenRecord record = acquirer(DeploymentMode.LOCAL, unsupported, supported).acquire(storage);

    assertEquals("cli", record.source());
    assertEquals(0, unsupported.calls());
  }

  @Test
  void alreadyExpiredGrant_isTransientFailure() {
    FakeCredentialSource source = new FakeCredentialSource("cli")
        .thenGrant(new AccessGrant("abc", TokenKind.BEARER, T0));

    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> acquirer(DeploymentMode.LOCAL, source).acquire(storage));

    assertEquals(TokenAcquisitionException.Reason.TRANSIENT, e.reason());
  }

  @Test
  void signedFallback_coversStorageButNotDatabase() {
    FakeCredentialSource cli = new FakeCredentialSource("cli")
        .otherwise(scope -> {
          throw new TokenAcquisitionException(
              scope.name(), TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE, "not logged in");
        });
    SharedKeySasSource sas = new SharedKeySasSource(
        "tiles", CredentialChainsTests.ACCOUNT_KEY, Duration.ofHours(1), clock);
    InteractiveIdentityChain chain = new InteractiveIdentityChain(List.of(cli, sas));
    TokenAcquirer acquirer = new TokenAcquirer(chain, clock, LoggerFactory.getLogger(TokenAcquirer.class));

    TokenRecord record = acquirer.acquire(storage);
    assertEquals(SharedKeySasSource.NAME, record.source());
    assertEquals(TokenKind.SHARED_ACCESS_SIGNATURE, record.kind());
    assertEquals(T0.plusSeconds(3600), record.expiresAt());

    TokenAcquisitionException e = assertThrows(TokenAcquisitionException.class, () -> acquirer.acquire(database));
    assertEquals(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE, e.reason());
    assertEquals(1, e.getSuppressed().length);
  }

  @Test
  void emptyChain_isUnavailable() {
    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> acquirer(DeploymentMode.PLATFORM).acquire(database));

    assertEquals(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE, e.reason());
    assertEquals(0, e.getSuppressed().length);
  }

  private TokenAcquirer acquirer(DeploymentMode mode, CredentialSource... sources) {
    return new TokenAcquirer(TestChains.of(mode, sources), clock, LoggerFactory.getLogger(TokenAcquirer.class));
  }
}
