/*
 * どこで: Conversion Relay ドメインモデル
 * 何を: 正規化・識別子付与済みのイベント
 * なぜ: 重複排除/同意判定/送信アダプタが共通で使う内部表現にするため
 */
package com.example.conversion.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record ConversionEvent(
    String eventId,
    String eventType,
    String shopDomain,
    String orderKey,
    String altOrderKey,
    String orderId,
    String checkoutToken,
    Instant occurredAt,
    BigDecimal value,
    String currency,
    List<LineItem> items,
    ConsentState consent) {

  public ConversionEvent {
    items = items == null ? List.of() : List.copyOf(items);
    consent = consent == null ? ConsentState.NONE : consent;
  }

  public boolean purchase() {
    return EventTypes.isPurchase(eventType);
  }
}
