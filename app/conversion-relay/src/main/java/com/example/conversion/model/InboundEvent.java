/*
 * どこで: Conversion Relay ドメインモデル
 * 何を: スキーマ検証済みだが未認証の受信イベントを表す
 * なぜ: 生の JSON をパイプライン内部へ持ち込まないため
 */
package com.example.conversion.model;

import java.math.BigDecimal;
import java.util.List;

public record InboundEvent(
    String eventName,
    long timestamp,
    String shopDomain,
    ConsentState consent,
    String nonce,
    String orderId,
    String checkoutToken,
    List<LineItem> items,
    BigDecimal value,
    String currency) {

  public InboundEvent {
    consent = consent == null ? ConsentState.NONE : consent;
    items = items == null ? List.of() : List.copyOf(items);
  }

  public String eventType() {
    return EventTypes.normalize(eventName);
  }
}
