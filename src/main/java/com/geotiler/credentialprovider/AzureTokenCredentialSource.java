package com.geotiler.credentialprovider;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.core.exception.ClientAuthenticationException;
import com.azure.core.exception.HttpResponseException;
import com.azure.identity.CredentialUnavailableException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Credential source backed by a Microsoft Entra ID {@link TokenCredential}
 * (for example {@code AzureCliCredential} or {@code ManagedIdentityCredential}).
 * <p>
 * The call is synchronous: {@link TokenCredential#getTokenSync} blocks until the identity
 * endpoint answers.
 */
public final class AzureTokenCredentialSource implements CredentialSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(AzureTokenCredentialSource.class);

  private static final int MAX_CAUSE_DEPTH = 8;

  private final String name;
  private final TokenCredential credential;

  public AzureTokenCredentialSource(String name, TokenCredential credential) {
    this.name = requireNonBlank(name, "name");
    this.credential = Objects.requireNonNull(credential, "credential");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public AccessGrant acquire(ScopeDefinition scope) {
    Objects.requireNonNull(scope, "scope");
    LOGGER.debug("Requesting {} token from {} for audience {}", scope.name(), name, scope.audience());

    TokenRequestContext context = new TokenRequestContext().addScopes(scope.audience());
    AccessToken token;
    try {
      token = credential.getTokenSync(context);
    } catch (RuntimeException e) {
      TokenAcquisitionException.Reason reason = classify(e);
      throw new TokenAcquisitionException(
          scope.name(),
          reason,
          name + " could not issue a " + scope.name() + " token (" + reason + "): " + e.getMessage(),
          e);
    }

    if (token == null) {
      throw new TokenAcquisitionException(
          scope.name(),
          TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE,
          name + " returned no token for " + scope.name());
    }

    return toAccessGrant(scope.name(), token);
  }

  TokenCredential credential() {
    return credential;
  }

  AccessGrant toAccessGrant(String scopeName, AccessToken token) {
    if (token.getToken() == null || token.getToken().isBlank()) {
      throw new TokenAcquisitionException(
          scopeName,
          TokenAcquisitionException.Reason.TRANSIENT,
          name + " returned a blank " + scopeName + " token");
    }
    if (token.getExpiresAt() == null) {
      throw new TokenAcquisitionException(
          scopeName,
          TokenAcquisitionException.Reason.TRANSIENT,
          name + " returned a " + scopeName + " token without an expiry");
    }
    return new AccessGrant(token.getToken(), TokenKind.BEARER, token.getExpiresAt().toInstant());
  }

  /**
   * Maps an azure-core / azure-identity failure onto the acquisition taxonomy. The whole cause
   * chain is inspected because the SDK wraps MSAL and transport errors.
   */
  static TokenAcquisitionException.Reason classify(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof CredentialUnavailableException) {
        return TokenAcquisitionException.Reason.IDENTITY_UNAVAILABLE;
      }
      if (current instanceof HttpResponseException) {
        HttpResponseException httpError = (HttpResponseException) current;
        if (httpError.getResponse() != null) {
          return classifyStatus(httpError.getResponse().getStatusCode());
        }
        if (current instanceof ClientAuthenticationException) {
          return TokenAcquisitionException.Reason.DENIED;
        }
      }
      if (current instanceof IOException
          || current instanceof UncheckedIOException
          || current instanceof TimeoutException) {
        return TokenAcquisitionException.Reason.TRANSIENT;
      }
      current = current.getCause();
    }
    return TokenAcquisitionException.Reason.TRANSIENT;
  }

  static TokenAcquisitionException.Reason classifyStatus(int statusCode) {
    if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
      return TokenAcquisitionException.Reason.TRANSIENT;
    }
    return TokenAcquisitionException.Reason.DENIED;
  }

  @Override
  public String toString() {
    return "AzureTokenCredentialSource{" + name + "}";
  }

  private static String requireNonBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must be non-blank");
    }
    return value;
  }
}
