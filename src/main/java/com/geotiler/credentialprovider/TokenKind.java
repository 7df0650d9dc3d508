package com.geotiler.credentialprovider;

/**
 * What kind of credential a token string is. Downstream consumers read the two kinds from
 * different variables.
 */
public enum TokenKind {
  /** OAuth bearer token issued by Microsoft Entra ID. */
  BEARER,

  /** Shared access signature derived locally from a storage account key. */
  SHARED_ACCESS_SIGNATURE
}
