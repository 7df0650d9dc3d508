package com.geotiler.credentialprovider;

import java.util.Locale;
import java.util.Objects;

/**
 * Which identity the process runs under. Read once at startup; never switched at runtime.
 */
public enum DeploymentMode {
  /** Developer workstation: the signed-in Azure CLI identity. */
  LOCAL,

  /** Deployed service: the managed identity assigned to the host. */
  PLATFORM;

  /**
   * Parses {@code local}/{@code platform}, also accepting {@code managed_identity} and
   * {@code managed-identity} for the platform mode.
   */
  public static DeploymentMode parse(String value) {
    Objects.requireNonNull(value, "value");
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "local":
      case "interactive":
        return LOCAL;
      case "platform":
      case "managed_identity":
      case "managed-identity":
        return PLATFORM;
      default:
        throw new IllegalArgumentException("Unknown deployment mode: " + value + " (expected local or platform)");
    }
  }
}
