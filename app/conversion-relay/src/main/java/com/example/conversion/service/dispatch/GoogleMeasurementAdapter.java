/*
 * どこで: Conversion Relay 送信アダプタ（GA4 Measurement Protocol）
 * 何を: 内部イベントを mp/collect ペイロードへ変換して送る
 * なぜ: region=eu の設定では EU 向けエンドポイントへ送るため
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
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@RequiredArgsConstructor
public class GoogleMeasurementAdapter implements PlatformAdapter {

  private static final Map<String, String> EVENT_NAMES =
      Map.of(
          "purchase", "purchase",
          "checkout_started", "begin_checkout",
          "product_added_to_cart", "add_to_cart",
          "product_viewed", "view_item",
          "page_viewed", "page_view",
          "search_submitted", "search",
          "cart_viewed", "view_cart",
          "collection_viewed", "view_item_list");

  private final PlatformHttpClient httpClient;
  private final DispatchProperties properties;

  @Override
  public Platform platform() {
    return Platform.GOOGLE;
  }

  @Override
  public DeliveryResult send(ConversionEvent event, PlatformCredentials credentials) {
    final List<String> missing = credentials.missing(Platform.GOOGLE.requiredCredentials());
    if (!missing.isEmpty()) {
      return DeliveryResult.failure(null, "missing_credentials: " + String.join(",", missing), null);
    }
    final URI uri =
        UriComponentsBuilder.fromUriString(endpointFor(credentials.region()))
            .queryParam("measurement_id", credentials.get("measurementId"))
            .queryParam("api_secret", credentials.get("apiSecret"))
            .encode()
            .build()
            .toUri();
    // MP は成功時 2xx/204 で本文を返さない
    return httpClient.postJson("google", uri, Map.of(), buildBody(event, credentials), null);
  }

  String endpointFor(String region) {
    if (region != null && "eu".equals(region.trim().toLowerCase(Locale.ROOT))) {
      return properties.googleEuUrl();
    }
    return properties.googleUrl();
  }

  Map<String, Object> buildBody(ConversionEvent event, PlatformCredentials credentials) {
    final Map<String, Object> params = new LinkedHashMap<>();
    if (event.orderId() != null) {
      params.put("transaction_id", event.orderId());
    }
    params.put("value", Money.asFloat(event.value()));
    params.put("currency", event.currency());
    final List<Map<String, Object>> items = new ArrayList<>();
    for (LineItem item : event.items()) {
      items.add(Map.of("item_id", item.id(), "quantity", item.quantity()));
    }
    params.put("items", items);
    params.put("engagement_time_msec", "1");
    if (credentials.testMode()) {
      params.put("debug_mode", true);
    }

    final Map<String, Object> gaEvent = new LinkedHashMap<>();
    gaEvent.put("name", EVENT_NAMES.getOrDefault(event.eventType(), event.eventType()));
    gaEvent.put("params", params);

    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("client_id", "server." + event.orderKey());
    body.put("events", List.of(gaEvent));
    return body;
  }
}
