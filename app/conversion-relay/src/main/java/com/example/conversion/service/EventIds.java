package com.example.conversion.service;

import com.example.common.Digests;
import com.example.conversion.model.LineItem;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 決定的なイベント ID。
 *
 * <p>SHA-256("shopDomain:identifier:eventType:itemsFingerprint:nonce") の 64 桁 16 進。注文/チェックアウト識別子を持つイベントは
 * nonce を空にするため、クライアントとサーバーから届いた同一イベントは同じ ID になる。
 */
public final class EventIds {

  private EventIds() {}

  public static String compute(
      String shopDomain,
      String identifier,
      String eventType,
      List<LineItem> items,
      String nonce) {
    final String material =
        String.join(
            ":",
            shopDomain,
            identifier,
            eventType,
            itemsFingerprint(items),
            nonce == null ? "" : nonce);
    return Digests.sha256Hex(material);
  }

  /** 並び順に依存しない明細の指紋。明細が無ければ空文字。 */
  public static String itemsFingerprint(List<LineItem> items) {
    if (items == null || items.isEmpty()) {
      return "";
    }
    final String joined =
        items.stream()
            .map(item -> item.id() + ":" + item.quantity())
            .sorted()
            .collect(Collectors.joining(","));
    return Digests.sha256Hex(joined);
  }
}
