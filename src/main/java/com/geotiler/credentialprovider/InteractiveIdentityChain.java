package com.geotiler.credentialprovider;

import com.azure.identity.AzureCliCredentialBuilder;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Developer workstation chain: the identity signed in with {@code az login}, then, when a storage
 * account key is configured locally, a SAS signed with that key.
 */
public final class InteractiveIdentityChain implements CredentialChain {
  public static final String AZURE_CLI_SOURCE = "azure-cli";

  private final List<CredentialSource> sources;

  InteractiveIdentityChain(List<CredentialSource> sources) {
    Objects.requireNonNull(sources, "sources");
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("sources must not be empty");
    }
    this.sources = List.copyOf(sources);
  }

  /**
   * @param tenantId optional; may be null/blank to use the CLI's default tenant
   * @param storageAccount account the shared key belongs to; required only with a key
   * @param storageAccountKey optional base64 account key for the signed fallback
   */
  public static InteractiveIdentityChain create(
      String tenantId,
      String storageAccount,
      String storageAccountKey,
      Duration sasLifetime,
      Clock clock) {
    AzureCliCredentialBuilder cli = new AzureCliCredentialBuilder();
    if (tenantId != null && !tenantId.isBlank()) {
      cli.tenantId(tenantId);
    }

    List<CredentialSource> sources = new ArrayList<>();
    sources.add(new AzureTokenCredentialSource(AZURE_CLI_SOURCE, cli.build()));
    if (storageAccountKey != null && !storageAccountKey.isBlank()) {
      sources.add(new SharedKeySasSource(storageAccount, storageAccountKey, sasLifetime, clock));
    }
    return new InteractiveIdentityChain(sources);
  }

  @Override
  public String name() {
    return "interactive";
  }

  @Override
  public DeploymentMode mode() {
    return DeploymentMode.LOCAL;
  }

  @Override
  public List<CredentialSource> sources() {
    return sources;
  }

  @Override
  public String toString() {
    return "InteractiveIdentityChain" + sources;
  }
}
