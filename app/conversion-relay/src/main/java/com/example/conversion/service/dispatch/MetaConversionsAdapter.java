/*
 * どこで: Conversion Relay 送信アダプタ（Meta Conversions API）
 * 何を: 内部イベントを Graph API の events ペイロードへ変換して送る
 * なぜ: ブラウザ Pixel と同じ event_id で送り、Meta 側の重複排除に乗せるため
 */
package com.example.conversion.service.dispatch;

import com.example.conversion.config.DispatchProperties;
import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.LineItem;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformCredentials;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@RequiredArgsConstructor
public class MetaConversionsAdapter implements PlatformAdapter {

  static final String API_VERSION = "v21.0";
  private static final Map<String, String> EVENT_NAMES =
      Map.of(
          "purchase", "Purchase",
          "checkout_started", "InitiateCheckout",
          "product_added_to_cart", "AddToCart",
          "product_viewed", "ViewContent",
          "page_viewed", "PageView",
          "search_submitted", "Search");

  private final PlatformHttpClient httpClient;
  private final DispatchProperties properties;

  @Override
  public Platform platform() {
    return Platform.META;
  }

  @Override
  public DeliveryResult send(ConversionEvent event, PlatformCredentials credentials) {
    final List<String> missing = credentials.missing(Platform.META.requiredCredentials());
    if (!missing.isEmpty()) {
      return DeliveryResult.failure(null, "missing_credentials: " + String.join(",", missing), null);
    }
    final URI uri =
        UriComponentsBuilder.fromUriString(properties.metaBaseUrl())
            .path("/" + API_VERSION + "/{pixelId}/events")
            .buildAndExpand(credentials.get("pixelId"))
            .encode()
            .toUri();
    return httpClient.postJson(
        "meta",
        uri,
        Map.of("Authorization", "Bearer " + credentials.get("accessToken")),
        buildBody(event, credentials),
        body -> body.has("error") ? body.path("error").path("message").asText("meta_error") : null);
  }

  Map<String, Object> buildBody(ConversionEvent event, PlatformCredentials credentials) {
    final Map<String, Object> customData = new LinkedHashMap<>();
    customData.put("currency", event.currency());
    customData.put("value", Money.asFloat(event.value()));
    if (event.orderId() != null) {
      customData.put("order_id", event.orderId());
    }
    final List<Map<String, Object>> contents = new ArrayList<>();
    for (LineItem item : event.items()) {
      contents.add(Map.of("id", item.id(), "quantity", item.quantity()));
    }
    customData.put("contents", contents);
    customData.put("content_type", "product");

    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("event_name", EVENT_NAMES.getOrDefault(event.eventType(), event.eventType()));
    data.put("event_time", event.occurredAt().getEpochSecond());
    data.put("event_id", event.eventId());
    data.put("action_source", "website");
    data.put("custom_data", customData);

    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("data", List.of(data));
    final String testEventCode = credentials.get("testEventCode");
    if (credentials.testMode() && testEventCode != null) {
      body.put("test_event_code", testEventCode);
    }
    return body;
  }
}
