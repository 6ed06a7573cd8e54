/*
 * どこで: Conversion Relay 送信アダプタ（Pinterest Conversions API）
 * 何を: 内部イベントを ad_accounts/{id}/events ペイロードへ変換して送る
 * なぜ: Pinterest は value を文字列で受け取り、test 環境はクエリで切り替えるため
 */
package com.example.conversion.service.dispatch;

import com.example.conversion.config.DispatchProperties;
import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.LineItem;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformCredentials;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@RequiredArgsConstructor
public class PinterestConversionsAdapter implements PlatformAdapter {

  private static final Map<String, String> EVENT_NAMES =
      Map.of(
          "purchase", "checkout",
          "product_added_to_cart", "add_to_cart",
          "page_viewed", "page_visit",
          "search_submitted", "search",
          "product_viewed", "view_category");

  private final PlatformHttpClient httpClient;
  private final DispatchProperties properties;

  @Override
  public Platform platform() {
    return Platform.PINTEREST;
  }

  @Override
  public DeliveryResult send(ConversionEvent event, PlatformCredentials credentials) {
    final List<String> missing = credentials.missing(Platform.PINTEREST.requiredCredentials());
    if (!missing.isEmpty()) {
      return DeliveryResult.failure(null, "missing_credentials: " + String.join(",", missing), null);
    }
    final UriComponentsBuilder builder =
        UriComponentsBuilder.fromUriString(properties.pinterestBaseUrl())
            .path("/v5/ad_accounts/{adAccountId}/events");
    if (credentials.testMode()) {
      builder.queryParam("test", "true");
    }
    final URI uri = builder.buildAndExpand(credentials.get("adAccountId")).encode().toUri();
    return httpClient.postJson(
        "pinterest",
        uri,
        Map.of("Authorization", "Bearer " + credentials.get("accessToken")),
        buildBody(event),
        body -> body.has("code") && body.has("message") ? body.path("message").asText() : null);
  }

  Map<String, Object> buildBody(ConversionEvent event) {
    int numItems = 0;
    for (LineItem item : event.items()) {
      numItems += item.quantity();
    }
    final Map<String, Object> customData = new LinkedHashMap<>();
    customData.put("currency", event.currency());
    customData.put("value", Money.asDecimalString(event.value()));
    if (event.orderId() != null) {
      customData.put("order_id", event.orderId());
    }
    customData.put("num_items", numItems);

    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("event_name", EVENT_NAMES.getOrDefault(event.eventType(), "custom"));
    data.put("action_source", "web");
    data.put("event_time", event.occurredAt().getEpochSecond());
    data.put("event_id", event.eventId());
    data.put("custom_data", customData);
    return Map.of("data", List.of(data));
  }
}
