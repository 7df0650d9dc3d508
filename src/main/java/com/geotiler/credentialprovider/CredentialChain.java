package com.geotiler.credentialprovider;

import com.azure.core.credential.TokenCredential;
import java.util.List;

/**
 * Ordered credential sources tried for every scope in this process.
 * <p>
 * Resolved once at startup from the {@link DeploymentMode}; the list never changes afterwards.
 */
public interface CredentialChain {
  String name();

  DeploymentMode mode();

  /**
   * Sources in the order they are tried. Immutable.
   */
  List<CredentialSource> sources();

  /**
   * The Entra ID credential of this chain, for Azure clients that authenticate themselves (Key
   * Vault).
   *
   * @throws IllegalStateException if the chain holds no Entra ID source
   */
  default TokenCredential identityCredential() {
    for (CredentialSource source : sources()) {
      if (source instanceof AzureTokenCredentialSource) {
        return ((AzureTokenCredentialSource) source).credential();
      }
    }
    throw new IllegalStateException("Credential chain " + name() + " holds no Entra ID identity");
  }
}
