/*
 * どこで: Conversion Relay 署名済みバッチ検査のユニットテスト
 * 何を: 重複注文/不正注文 ID/非標準イベントの各しきい値と境界を検証する
 * なぜ: 漏えいシークレットでの水増しは検出しつつ、通常のファネル送信は通すことを担保するため
 */
package com.example.conversion.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.conversion.model.ConsentState;
import com.example.conversion.model.InboundEvent;
import com.example.conversion.service.auth.BatchAbuseDetector.AbuseFinding;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BatchAbuseDetectorTest {

  private final BatchAbuseDetector detector = new BatchAbuseDetector();

  @Test
  void batchesBelowMinimumSizeAreNotInspected() {
    final List<InboundEvent> events =
        List.of(event("custom_ping", "bad id"), event("custom_ping", "bad id"));

    assertThat(detector.inspect(events)).isEmpty();
  }

  @Test
  void repeatedOrderIdIsFlaggedAsDuplicate() {
    final List<InboundEvent> events =
        Collections.nCopies(10, event("purchase", "gid://shopify/Order/1001"));

    final Optional<AbuseFinding> finding = detector.inspect(events);

    assertThat(finding).isPresent();
    assertThat(finding.get().kinds()).containsExactly("high_duplicate_order_keys");
    assertThat(finding.get().reasons()).containsExactly("high_duplicate_order_keys:0.90");
    assertThat(finding.get().totalEvents()).isEqualTo(10);
  }

  @Test
  void duplicateRateBelowThresholdIsNotFlagged() {
    // 注文 ID 付き 4 件中ユニーク 1 件で重複率 0.75
    final List<InboundEvent> events =
        Collections.nCopies(4, event("purchase", "gid://shopify/Order/1001"));

    assertThat(detector.inspect(events)).isEmpty();
  }

  @Test
  void malformedOrderIdsAboveThresholdAreFlagged() {
    final List<InboundEvent> events =
        List.of(
            event("purchase", "order 1"),
            event("purchase", "x".repeat(257)),
            event("purchase", "<script>"),
            event("purchase", "gid://shopify/Order/1"),
            event("purchase", "gid://shopify/Order/2"));

    final Optional<AbuseFinding> finding = detector.inspect(events);

    assertThat(finding).isPresent();
    assertThat(finding.get().kinds()).containsExactly("high_invalid_order_keys");
    assertThat(finding.get().invalidOrderRate()).isEqualTo(0.6d);
  }

  @Test
  void invalidRateAtOrBelowThresholdIsNotFlagged() {
    final List<InboundEvent> events = new ArrayList<>();
    events.add(event("purchase", "order 1"));
    events.add(event("purchase", "order 2"));
    events.add(event("purchase", "order 3"));
    IntStream.rangeClosed(1, 7).forEach(i -> events.add(event("purchase", "ORD-" + i)));

    assertThat(detector.inspect(events)).isEmpty();
  }

  @Test
  void mostlyNonStandardEventsAreFlagged() {
    final List<InboundEvent> events =
        List.of(
            event("custom_ping", null),
            event("custom_ping", null),
            event("custom_ping", null),
            event("page_viewed", null));

    final Optional<AbuseFinding> finding = detector.inspect(events);

    assertThat(finding).isPresent();
    assertThat(finding.get().kinds()).containsExactly("high_non_standard_events");
    assertThat(finding.get().nonStandardEventRate()).isEqualTo(0.75d);
  }

  @Test
  void halfNonStandardEventsAreNotFlagged() {
    final List<InboundEvent> events =
        List.of(
            event("custom_ping", null),
            event("custom_ping", null),
            event("page_viewed", null),
            event("product_viewed", null));

    assertThat(detector.inspect(events)).isEmpty();
  }

  @Test
  void ordinaryFunnelBatchIsNotFlagged() {
    final List<InboundEvent> events =
        List.of(
            event("page_viewed", null),
            event("product_viewed", null),
            event("product_added_to_cart", null),
            event("checkout_started", null),
            event("checkout_completed", "gid://shopify/Order/1001"),
            event("purchase", "gid://shopify/Order/1001"));

    assertThat(detector.inspect(events)).isEmpty();
  }

  @Test
  void everyExceededThresholdIsReported() {
    final List<InboundEvent> events = Collections.nCopies(4, event("custom_ping", "bad id"));

    final Optional<AbuseFinding> finding = detector.inspect(events);

    assertThat(finding).isPresent();
    assertThat(finding.get().kinds())
        .containsExactly("high_invalid_order_keys", "high_non_standard_events");
    // 不正 ID は重複率の分母に入らない
    assertThat(finding.get().duplicateOrderRate()).isZero();
  }

  private static InboundEvent event(String eventName, String orderId) {
    return new InboundEvent(
        eventName,
        1_760_000_000_000L,
        "demo.myshopify.com",
        ConsentState.NONE,
        null,
        orderId,
        null,
        null,
        null,
        null);
  }
}
