/*
 * どこで: Conversion Relay 署名検証のユニットテスト
 * 何を: 現行/旧シークレット、時刻窓、欠落ヘッダーの判定を検証する
 * なぜ: ローテーション猶予が切れた旧シークレットを受け付けないことを担保するため
 */
package com.example.conversion.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.Digests;
import com.example.conversion.config.IngestProperties;
import com.example.conversion.model.Shop;
import com.example.conversion.model.TrackingMode;
import com.example.conversion.service.auth.SignatureVerifier.SignatureCheck;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SignatureVerifierTest {

  private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
  private static final String BODY = "{\"eventName\":\"purchase\"}";
  private static final String DOMAIN = "demo.myshopify.com";

  private final SignatureVerifier verifier =
      new SignatureVerifier(
          new IngestProperties(
              null, null, Duration.ofMinutes(5), null, true, false, true, false, null, null, null,
              null, null));

  @Test
  void verifiesWithCurrentSecret() {
    final long ts = NOW.toEpochMilli();

    final SignatureCheck check =
        verifier.verify(shop(null), sign("current-secret", ts), Long.toString(ts), BODY, NOW);

    assertThat(check.verified()).isTrue();
    assertThat(check.usedPreviousSecret()).isFalse();
  }

  @Test
  void acceptsUppercaseHexSignature() {
    final long ts = NOW.toEpochMilli();
    final String upper = sign("current-secret", ts).toUpperCase(Locale.ROOT);

    assertThat(verifier.verify(shop(null), upper, Long.toString(ts), BODY, NOW).verified()).isTrue();
  }

  @Test
  void verifiesWithPreviousSecretDuringGracePeriod() {
    final long ts = NOW.toEpochMilli();

    final SignatureCheck check =
        verifier.verify(
            shop(NOW.plus(Duration.ofHours(1))), sign("old-secret", ts), Long.toString(ts), BODY, NOW);

    assertThat(check.verified()).isTrue();
    assertThat(check.usedPreviousSecret()).isTrue();
  }

  @Test
  void rejectsPreviousSecretAfterGracePeriod() {
    final long ts = NOW.toEpochMilli();

    final SignatureCheck check =
        verifier.verify(
            shop(NOW.minusSeconds(1)), sign("old-secret", ts), Long.toString(ts), BODY, NOW);

    assertThat(check.status()).isEqualTo(SignatureCheck.Status.MISMATCH);
  }

  @Test
  void rejectsTimestampOutsideWindow() {
    final long ts = NOW.minus(Duration.ofMinutes(6)).toEpochMilli();

    final SignatureCheck check =
        verifier.verify(shop(null), sign("current-secret", ts), Long.toString(ts), BODY, NOW);

    assertThat(check.status()).isEqualTo(SignatureCheck.Status.INVALID_TIMESTAMP);
  }

  @Test
  void rejectsNonNumericTimestamp() {
    final SignatureCheck check =
        verifier.verify(shop(null), "abc", "yesterday", BODY, NOW);

    assertThat(check.status()).isEqualTo(SignatureCheck.Status.INVALID_TIMESTAMP);
  }

  @Test
  void reportsMissingSignatureBeforeAnythingElse() {
    assertThat(verifier.verify(shop(null), " ", null, BODY, NOW).status())
        .isEqualTo(SignatureCheck.Status.MISSING_SIGNATURE);
  }

  @Test
  void reportsMissingSecretWhenShopHasNone() {
    final Shop noSecret =
        new Shop(
            UUID.randomUUID(), DOMAIN, null, List.of(), null, null, null,
            TrackingMode.PURCHASE_ONLY, true);

    assertThat(verifier.verify(noSecret, "abc", "1", BODY, NOW).status())
        .isEqualTo(SignatureCheck.Status.MISSING_SECRET);
  }

  @Test
  void bodyTamperingBreaksSignature() {
    final long ts = NOW.toEpochMilli();

    final SignatureCheck check =
        verifier.verify(
            shop(null), sign("current-secret", ts), Long.toString(ts), BODY + " ", NOW);

    assertThat(check.status()).isEqualTo(SignatureCheck.Status.MISMATCH);
  }

  private static String sign(String secret, long ts) {
    return Digests.hmacSha256Hex(secret, SignatureVerifier.signedMessage(ts, DOMAIN, BODY));
  }

  private static Shop shop(Instant previousExpiresAt) {
    return new Shop(
        UUID.randomUUID(),
        DOMAIN,
        null,
        List.of(),
        "current-secret",
        "old-secret",
        previousExpiresAt,
        TrackingMode.PURCHASE_ONLY,
        true);
  }
}
