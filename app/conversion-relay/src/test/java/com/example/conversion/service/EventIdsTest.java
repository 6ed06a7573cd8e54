package com.example.conversion.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.conversion.model.LineItem;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventIdsTest {

  @Test
  void sameOrderFromClientAndServerGetsSameId() {
    final String fromPixel =
        EventIds.compute(
            "demo.myshopify.com",
            "1001",
            "purchase",
            List.of(new LineItem("a", 1), new LineItem("b", 2)),
            "");
    final String fromWebhook =
        EventIds.compute(
            "demo.myshopify.com",
            "1001",
            "purchase",
            List.of(new LineItem("b", 2), new LineItem("a", 1)),
            null);

    assertThat(fromPixel).isEqualTo(fromWebhook).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  void nonceSeparatesAnonymousEvents() {
    final String first = EventIds.compute("demo.myshopify.com", "session_1", "page_viewed", List.of(), "n-1");
    final String second = EventIds.compute("demo.myshopify.com", "session_1", "page_viewed", List.of(), "n-2");

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void itemsFingerprintIsEmptyWithoutItems() {
    assertThat(EventIds.itemsFingerprint(List.of())).isEmpty();
    assertThat(EventIds.itemsFingerprint(null)).isEmpty();
  }
}
