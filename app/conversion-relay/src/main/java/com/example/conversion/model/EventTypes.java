package com.example.conversion.model;

import java.util.Locale;
import java.util.Set;

public final class EventTypes {

  public static final String PURCHASE = "purchase";
  private static final String CHECKOUT_COMPLETED = "checkout_completed";

  /** ピクセルが標準で送るイベント名。これ以外が多いバッチは不正利用を疑う。 */
  private static final Set<String> STANDARD_EVENT_NAMES =
      Set.of(
          "page_viewed",
          "product_viewed",
          "product_added_to_cart",
          "collection_viewed",
          "search_submitted",
          "cart_viewed",
          "checkout_started",
          CHECKOUT_COMPLETED,
          PURCHASE);

  private EventTypes() {}

  public static boolean isStandard(String eventName) {
    return eventName != null && STANDARD_EVENT_NAMES.contains(eventName);
  }

  /** checkout_completed は purchase に正規化する。 */
  public static String normalize(String eventName) {
    if (eventName == null) {
      return "";
    }
    final String lower = eventName.trim().toLowerCase(Locale.ROOT);
    return CHECKOUT_COMPLETED.equals(lower) ? PURCHASE : lower;
  }

  public static boolean isPurchase(String eventType) {
    return PURCHASE.equals(eventType);
  }
}
