/*
 * どこで: Conversion Relay 重複排除
 * 何を: 注文 ID/チェックアウトトークンから突合用の注文キーを導出する
 * なぜ: クライアント送信とサーバー送信の同一注文を同じキーへ寄せるため
 */
package com.example.conversion.service;

import com.example.common.Digests;
import com.example.conversion.model.EventTypes;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class OrderKeys {

  private static final Pattern GID_ORDER = Pattern.compile("^gid://shopify/Order/(\\d+)$");
  private static final Pattern TRAILING_DIGITS = Pattern.compile("(\\d+)$");
  private static final Pattern GID_ANY = Pattern.compile("^gid://shopify/\\w+/\\d+$");
  private static final Pattern PLAIN_ID = Pattern.compile("^[a-zA-Z0-9_\\-.:/]+$");
  private static final int MAX_ORDER_ID_LENGTH = 256;

  private OrderKeys() {}

  /** gid://shopify/Order/123 → 123、それ以外は末尾の数字列、数字が無ければそのまま。 */
  public static String normalizeOrderId(String orderId) {
    if (orderId == null || orderId.isBlank()) {
      return null;
    }
    final String trimmed = orderId.trim();
    final Matcher gid = GID_ORDER.matcher(trimmed);
    if (gid.matches()) {
      return gid.group(1);
    }
    final Matcher trailing = TRAILING_DIGITS.matcher(trimmed);
    if (trailing.find()) {
      return trailing.group(1);
    }
    return trimmed;
  }

  /** 256 文字以内で、Shopify の GID か英数字と {@code _-.:/} だけから成る注文 ID か。 */
  public static boolean isWellFormedOrderId(String orderId) {
    if (orderId == null || orderId.length() > MAX_ORDER_ID_LENGTH) {
      return false;
    }
    return GID_ANY.matcher(orderId).matches() || PLAIN_ID.matcher(orderId).matches();
  }

  /**
   * イベント種別ごとの注文キーを導出する。
   *
   * @return 購入イベントで注文 ID もトークンも無い場合は empty（検証エラー）
   */
  public static Optional<OrderKey> resolve(
      String eventType, String orderId, String checkoutToken, long timestamp, String shopDomain) {
    final String normalizedOrderId = normalizeOrderId(orderId);
    final String token = checkoutToken == null || checkoutToken.isBlank() ? null : checkoutToken;
    if (normalizedOrderId != null) {
      return Optional.of(new OrderKey(normalizedOrderId, token, normalizedOrderId));
    }
    if (EventTypes.isPurchase(eventType)) {
      if (token == null) {
        return Optional.empty();
      }
      return Optional.of(new OrderKey(token, null, null));
    }
    if (token != null) {
      return Optional.of(new OrderKey("checkout_" + Digests.sha256Hex(token), null, null));
    }
    final String shopPart = shopDomain.replace('.', '_').toLowerCase(Locale.ROOT);
    return Optional.of(new OrderKey("session_" + timestamp + "_" + shopPart, null, null));
  }

  /**
   * @param orderKey 突合と重複判定に使う主キー
   * @param altOrderKey 注文 ID とトークンが両方ある場合のトークン
   * @param orderId 正規化済み注文 ID（無ければ null）
   */
  public record OrderKey(String orderKey, String altOrderKey, String orderId) {

    public boolean hasIdentifier() {
      return orderId != null || !orderKey.startsWith("session_");
    }
  }
}
