package com.example.conversion.model;

import java.util.Locale;
import java.util.Set;

public enum TrackingMode {
  PURCHASE_ONLY(Set.of(EventTypes.PURCHASE)),
  FULL_FUNNEL(
      Set.of(
          EventTypes.PURCHASE,
          "page_viewed",
          "product_viewed",
          "product_added_to_cart",
          "checkout_started",
          "search_submitted",
          "collection_viewed",
          "cart_viewed"));

  private final Set<String> acceptedEventTypes;

  TrackingMode(Set<String> acceptedEventTypes) {
    this.acceptedEventTypes = acceptedEventTypes;
  }

  public boolean accepts(String eventType) {
    return acceptedEventTypes.contains(eventType);
  }

  public static TrackingMode fromDb(String value) {
    return value == null ? PURCHASE_ONLY : valueOf(value.toUpperCase(Locale.ROOT));
  }

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
