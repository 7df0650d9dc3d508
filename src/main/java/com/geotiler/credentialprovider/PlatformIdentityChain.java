package com.geotiler.credentialprovider;

import com.azure.identity.ManagedIdentityCredentialBuilder;
import java.util.List;
import java.util.Objects;

/**
 * Deployed service chain: the managed identity of the host. Holds no secret-based source.
 */
public final class PlatformIdentityChain implements CredentialChain {
  public static final String MANAGED_IDENTITY_SOURCE = "managed-identity";

  private final List<CredentialSource> sources;

  PlatformIdentityChain(List<CredentialSource> sources) {
    Objects.requireNonNull(sources, "sources");
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("sources must not be empty");
    }
    for (CredentialSource source : sources) {
      if (source instanceof SharedKeySasSource) {
        throw new IllegalArgumentException("Platform identity chain must not hold a shared key source");
      }
    }
    this.sources = List.copyOf(sources);
  }

  /**
   * @param clientId client id of a user-assigned identity; null/blank selects the system-assigned one
   */
  public static PlatformIdentityChain create(String clientId) {
    ManagedIdentityCredentialBuilder builder = new ManagedIdentityCredentialBuilder();
    String sourceName = MANAGED_IDENTITY_SOURCE;
    if (clientId != null && !clientId.isBlank()) {
      builder.clientId(clientId);
      sourceName = MANAGED_IDENTITY_SOURCE + ":" + clientId;
    }
    return new PlatformIdentityChain(List.of(new AzureTokenCredentialSource(sourceName, builder.build())));
  }

  @Override
  public String name() {
    return "platform";
  }

  @Override
  public DeploymentMode mode() {
    return DeploymentMode.PLATFORM;
  }

  @Override
  public List<CredentialSource> sources() {
    return sources;
  }

  @Override
  public String toString() {
    return "PlatformIdentityChain" + sources;
  }
}
