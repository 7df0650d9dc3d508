package com.geotiler.credentialprovider;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Azure Storage account SAS signer.
 * <p>
 * Format and signing details:
 * https://learn.microsoft.com/en-us/rest/api/storageservices/create-account-sas#version-2015-04-05-through-version-2020-02-10
 */
public final class SharedKeySasSigner {
  /**
   * Storage service version the string-to-sign layout below belongs to.
   */
  public static final String DEFAULT_SERVICE_VERSION = "2019-12-12";

  public static final String BLOB_SERVICE = "b";
  public static final String CONTAINER_AND_OBJECT = "co";
  public static final String READ_LIST_PERMISSIONS = "rl";
  public static final String HTTPS_ONLY = "https";

  // Whole seconds only, so two signatures within the same second are identical.
  private static final DateTimeFormatter ISO_8601_SECONDS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT)
          .withZone(ZoneOffset.UTC);

  private SharedKeySasSigner() {
  }

  /**
   * Expiry actually encoded in a SAS signed for {@code expiresAt}.
   */
  public static Instant signedExpiry(Instant expiresAt) {
    Objects.requireNonNull(expiresAt, "expiresAt");
    return expiresAt.truncatedTo(ChronoUnit.SECONDS);
  }

  /**
   * Builds the account SAS string-to-sign. Start time and IP range are left empty.
   */
  public static String stringToSign(
      String accountName,
      String permissions,
      String services,
      String resourceTypes,
      String signedExpiry,
      String protocol,
      String version) {
    Objects.requireNonNull(accountName, "accountName");
    Objects.requireNonNull(permissions, "permissions");
    Objects.requireNonNull(services, "services");
    Objects.requireNonNull(resourceTypes, "resourceTypes");
    Objects.requireNonNull(signedExpiry, "signedExpiry");
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(version, "version");

    return accountName + "\n" +
        permissions + "\n" +
        services + "\n" +
        resourceTypes + "\n" +
        "\n" +
        signedExpiry + "\n" +
        "\n" +
        protocol + "\n" +
        version + "\n";
  }

  /**
   * Generates a read/list account SAS for blob containers and objects.
   *
   * @param base64AccountKey the storage account key exactly as the portal shows it
   * @return the SAS query string, without a leading {@code ?}
   */
  public static String generateAccountSas(String accountName, String base64AccountKey, Instant expiresAt) {
    return generateAccountSas(
        accountName,
        base64AccountKey,
        expiresAt,
        READ_LIST_PERMISSIONS,
        DEFAULT_SERVICE_VERSION);
  }

  public static String generateAccountSas(
      String accountName,
      String base64AccountKey,
      Instant expiresAt,
      String permissions,
      String version) {
    Objects.requireNonNull(accountName, "accountName");
    Objects.requireNonNull(base64AccountKey, "base64AccountKey");
    Objects.requireNonNull(expiresAt, "expiresAt");
    Objects.requireNonNull(permissions, "permissions");
    Objects.requireNonNull(version, "version");

    String signedExpiry = ISO_8601_SECONDS.format(signedExpiry(expiresAt));
    String payload = stringToSign(
        accountName,
        permissions,
        BLOB_SERVICE,
        CONTAINER_AND_OBJECT,
        signedExpiry,
        HTTPS_ONLY,
        version);

    String signature = sign(payload, base64AccountKey);

    return "sv=" + encode(version) +
        "&ss=" + BLOB_SERVICE +
        "&srt=" + CONTAINER_AND_OBJECT +
        "&sp=" + encode(permissions) +
        "&se=" + encode(signedExpiry) +
        "&spr=" + HTTPS_ONLY +
        "&sig=" + encode(signature);
  }

  static String sign(String payload, String base64AccountKey) {
    byte[] keyBytes = Base64.getDecoder().decode(base64AccountKey);
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(keyBytes, "HmacSHA256"));
      byte[] hash = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(hash);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to compute storage SAS signature.", e);
    } finally {
      Arrays.fill(keyBytes, (byte) 0);
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
