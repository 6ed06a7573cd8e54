/*
 * どこで: 共通ユーティリティ
 * 何を: SHA-256 / HMAC-SHA256 の hex 文字列化と定数時間比較を提供する
 * なぜ: 署名検証と重複排除キー生成で同じ実装を使うため
 */
package com.example.common;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public final class Digests {

  private static final String HMAC_SHA256 = "HmacSHA256";
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Digests() {}

  public static String sha256Hex(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  public static String hmacSha256Hex(String secret, String message) {
    try {
      final Mac mac = Mac.getInstance(HMAC_SHA256);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
      return toHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
      throw new IllegalStateException("HmacSHA256 not available", ex);
    }
  }

  /** ログ出力用の短いハッシュ（先頭 12 文字）。注文 ID など生値を残したくない値に使う。 */
  public static String logSafe(String value) {
    if (value == null) {
      return "-";
    }
    return sha256Hex(value).substring(0, 12);
  }

  /** 長さの違いも含めて比較時間が入力内容に依存しないようにする。 */
  public static boolean constantTimeEquals(String expected, String actual) {
    if (expected == null || actual == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
  }

  private static String toHex(byte[] bytes) {
    final char[] out = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      final int v = bytes[i] & 0xff;
      out[i * 2] = HEX[v >>> 4];
      out[i * 2 + 1] = HEX[v & 0x0f];
    }
    return new String(out);
  }
}
