/*
 * どこで: Conversion Relay 認証
 * 何を: 受信本文の HMAC 署名を現行/旧シークレットで検証する
 * なぜ: シークレットのローテーション中も無停止で受信を続けるため
 */
package com.example.conversion.service.auth;

import com.example.common.Digests;
import com.example.conversion.config.IngestProperties;
import com.example.conversion.model.Shop;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 署名は hex(HMAC-SHA256(secret, "timestamp:shopDomain:sha256hex(rawBody)"))。timestamp はエポックミリ秒で、受信時刻から
 * timestamp-window 以内であること。
 */
@Component
@RequiredArgsConstructor
public class SignatureVerifier {

  private final IngestProperties properties;

  public SignatureCheck verify(
      Shop shop, String signature, String timestampHeader, String rawBody, Instant now) {
    if (signature == null || signature.isBlank()) {
      return SignatureCheck.of(SignatureCheck.Status.MISSING_SIGNATURE);
    }
    if (shop.ingestionSecret() == null || shop.ingestionSecret().isBlank()) {
      return SignatureCheck.of(SignatureCheck.Status.MISSING_SECRET);
    }
    final Long timestamp = parseMillis(timestampHeader);
    if (timestamp == null || !withinWindow(timestamp, now)) {
      return SignatureCheck.of(SignatureCheck.Status.INVALID_TIMESTAMP);
    }
    final String message = signedMessage(timestamp, shop.shopDomain(), rawBody);
    final String provided = signature.trim().toLowerCase(Locale.ROOT);
    if (Digests.constantTimeEquals(Digests.hmacSha256Hex(shop.ingestionSecret(), message), provided)) {
      return new SignatureCheck(SignatureCheck.Status.VERIFIED, false);
    }
    if (shop.previousSecretUsable(now)
        && Digests.constantTimeEquals(
            Digests.hmacSha256Hex(shop.previousIngestionSecret(), message), provided)) {
      return new SignatureCheck(SignatureCheck.Status.VERIFIED, true);
    }
    return SignatureCheck.of(SignatureCheck.Status.MISMATCH);
  }

  public static String signedMessage(long timestamp, String shopDomain, String rawBody) {
    return timestamp + ":" + shopDomain + ":" + Digests.sha256Hex(rawBody);
  }

  private boolean withinWindow(long timestampMillis, Instant now) {
    final Duration skew = Duration.between(Instant.ofEpochMilli(timestampMillis), now).abs();
    return skew.compareTo(properties.timestampWindow()) <= 0;
  }

  private Long parseMillis(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  public record SignatureCheck(Status status, boolean usedPreviousSecret) {

    public enum Status {
      VERIFIED,
      MISSING_SIGNATURE,
      MISSING_SECRET,
      INVALID_TIMESTAMP,
      MISMATCH
    }

    static SignatureCheck of(Status status) {
      return new SignatureCheck(status, false);
    }

    public boolean verified() {
      return status == Status.VERIFIED;
    }
  }
}
