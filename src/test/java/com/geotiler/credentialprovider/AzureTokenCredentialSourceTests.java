package com.geotiler.credentialprovider;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.exception.ClientAuthenticationException;
import com.azure.identity.CredentialUnavailableException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

public class AzureTokenCredentialSourceTests {
  private final ScopeDefinition storage = ScopeRegistry.defaults().require(ScopeRegistry.STORAGE_ACCESS);

  @Test
  void acquire_requestsScopeAudience_andKeepsTokenExpiry() {
    List<String> requestedScopes = new CopyOnWriteArrayList<>();
    OffsetDateTime expiresOn = OffsetDateTime.of(2026, 1, 1, 1, 0, 0, 0, ZoneOffset.UTC);
    TokenCredential credential = request -> {
      requestedScopes.addAll(request.getScopes());
      return Mono.just(new AccessToken("bearer-value", expiresOn));
    };

    AccessGrant grant = new AzureTokenCredentialSource("azure-cli", credential).acquire(storage);

    assertEquals(List.of("https://storage.azure.com/.default"), requestedScopes);
    assertEquals("bearer-value", grant.value());
    assertEquals(TokenKind.BEARER, grant.kind());
    assertEquals(Instant.parse("2026-01-01T01:00:00Z"), grant.expiresAt());
  }

  @Test
  void unavailableCredential_isIdentityUnavailable() {
    TokenCredential credential = request -> Mono.error(new CredentialUnavailableException("Please run 'az login'"));

    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> new AzureTokenCredentialSource("azure-cli", credential).acquire(storage));

    assertEquals(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE, e.reason());
    assertEquals(ScopeRegistry.STORAGE_ACCESS, e.scopeName());
    assertTrue(e.getCause() instanceof CredentialUnavailableException);
  }

  @Test
  void authenticationFailure_isDenied() {
    TokenCredential credential = request -> Mono.error(new ClientAuthenticationException("AADSTS700016", null));

    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> new AzureTokenCredentialSource("managed-identity", credential).acquire(storage));

    assertEquals(TokenAcquisitionException.Reason.DENIED, e.reason());
  }

  @Test
  void blankToken_isTransientAcquisitionFailure() {
    OffsetDateTime expiresOn = OffsetDateTime.now(ZoneOffset.UTC).plusHours(1);
    TokenCredential credential = request -> Mono.just(new AccessToken("", expiresOn));

    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> new AzureTokenCredentialSource("managed-identity", credential).acquire(storage));

    assertEquals(TokenAcquisitionException.Reason.TRANSIENT, e.reason());
    assertEquals(ScopeRegistry.STORAGE_ACCESS, e.scopeName());
  }

  @Test
  void emptyResponse_isIdentityUnavailable() {
    TokenCredential credential = request -> Mono.empty();

    TokenAcquisitionException e = assertThrows(
        TokenAcquisitionException.class,
        () -> new AzureTokenCredentialSource("managed-identity", credential).acquire(storage));

    assertEquals(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE, e.reason());
  }

  @Test
  void classify_walksCauseChain() {
    assertEquals(TokenAcquisitionException.Reason.TRANSIENT,
        AzureTokenCredentialSource.classify(new UncheckedIOException(new IOException("connection reset"))));
    assertEquals(TokenAcquisitionException.Reason.TRANSIENT,
        AzureTokenCredentialSource.classify(new IllegalStateException(new TimeoutException("imds"))));
    assertEquals(TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE,
        AzureTokenCredentialSource.classify(
            new RuntimeException("wrapped", new CredentialUnavailableException("no identity"))));
    assertEquals(TokenAcquisitionException.Reason.TRANSIENT,
        AzureTokenCredentialSource.classify(new IllegalStateException("unexpected")));
  }

  @Test
  void classifyStatus_separatesRetryableFromDenied() {
    assertEquals(TokenAcquisitionException.Reason.DENIED, AzureTokenCredentialSource.classifyStatus(400));
    assertEquals(TokenAcquisitionException.Reason.DENIED, AzureTokenCredentialSource.classifyStatus(401));
    assertEquals(TokenAcquisitionException.Reason.DENIED, AzureTokenCredentialSource.classifyStatus(403));
    assertEquals(TokenAcquisitionException.Reason.TRANSIENT, AzureTokenCredentialSource.classifyStatus(408));
    assertEquals(TokenAcquisitionException.Reason.TRANSIENT, AzureTokenCredentialSource.classifyStatus(429));
    assertEquals(TokenAcquisitionException.Reason.TRANSIENT, AzureTokenCredentialSource.classifyStatus(500));
    assertEquals(TokenAcquisitionException.Reason.TRANSIENT, AzureTokenCredentialSource.classifyStatus(503));
  }

  @Test
  void toString_namesSourceOnly() {
    TokenCredential credential = request -> Mono.empty();

    assertEquals("AzureTokenCredentialSource{azure-cli}",
        new AzureTokenCredentialSource("azure-cli", credential).toString());
  }
}
