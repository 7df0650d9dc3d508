package com.geotiler.credentialprovider;

import java.time.Clock;
import java.util.Objects;

/**
 * Picks the credential chain for this process.
 */
public final class CredentialChains {
  private CredentialChains() {
  }

  public static CredentialChain resolve(CredentialSettings settings, CredentialProviderOptions options, Clock clock) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(clock, "clock");

    switch (settings.deploymentMode()) {
      case LOCAL:
        return InteractiveIdentityChain.create(
            settings.tenantId(),
            settings.storageAccount(),
            settings.storageAccountKey(),
            options.sharedKeySasLifetime(),
            clock);
      case PLATFORM:
        return PlatformIdentityChain.create(settings.managedIdentityClientId());
      default:
        throw new IllegalStateException("Unhandled deployment mode: " + settings.deploymentMode());
    }
  }
}
