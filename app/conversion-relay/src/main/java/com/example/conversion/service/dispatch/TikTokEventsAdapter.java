/*
 * どこで: Conversion Relay 送信アダプタ（TikTok Events API）
 * 何を: 内部イベントを event/track ペイロードへ変換して送る
 * なぜ: TikTok は 2xx でも code != 0 を失敗として返すため、本文まで判定する
 */
package com.example.conversion.service.dispatch;

import com.example.conversion.config.DispatchProperties;
import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.LineItem;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformCredentials;
import java.net.URI;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TikTokEventsAdapter implements PlatformAdapter {

  private static final Map<String, String> EVENT_NAMES =
      Map.of(
          "purchase", "CompletePayment",
          "checkout_started", "InitiateCheckout",
          "product_added_to_cart", "AddToCart",
          "product_viewed", "ViewContent",
          "search_submitted", "Search",
          "page_viewed", "Pageview");

  private final PlatformHttpClient httpClient;
  private final DispatchProperties properties;

  @Override
  public Platform platform() {
    return Platform.TIKTOK;
  }

  @Override
  public DeliveryResult send(ConversionEvent event, PlatformCredentials credentials) {
    final List<String> missing = credentials.missing(Platform.TIKTOK.requiredCredentials());
    if (!missing.isEmpty()) {
      return DeliveryResult.failure(null, "missing_credentials: " + String.join(",", missing), null);
    }
    return httpClient.postJson(
        "tiktok",
        URI.create(properties.tiktokUrl()),
        Map.of("Access-Token", credentials.get("accessToken")),
        buildBody(event, credentials),
        body -> {
          final int code = body.path("code").asInt(0);
          return code == 0 ? null : "tiktok_code_" + code + ": " + body.path("message").asText("");
        });
  }

  Map<String, Object> buildBody(ConversionEvent event, PlatformCredentials credentials) {
    final Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("currency", event.currency());
    properties.put("value", Money.asFloat(event.value()));
    if (event.orderId() != null) {
      properties.put("order_id", event.orderId());
    }
    final List<Map<String, Object>> contents = new ArrayList<>();
    for (LineItem item : event.items()) {
      contents.add(Map.of("content_id", item.id(), "quantity", item.quantity()));
    }
    properties.put("contents", contents);
    properties.put("content_type", "product");

    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("pixel_code", credentials.get("pixelId"));
    data.put("event", EVENT_NAMES.getOrDefault(event.eventType(), event.eventType()));
    data.put("event_id", event.eventId());
    data.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(event.occurredAt()));
    data.put("properties", properties);

    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("data", List.of(data));
    final String testEventCode = credentials.get("testEventCode");
    if (credentials.testMode() && testEventCode != null) {
      body.put("test_event_code", testEventCode);
    }
    return body;
  }
}
