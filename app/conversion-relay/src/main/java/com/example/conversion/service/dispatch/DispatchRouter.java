/*
 * どこで: Conversion Relay 送信ルーター
 * 何を: プラットフォームのタグから網羅 switch でアダプタを選び、呼び出し時間を計測する
 * なぜ: ペイロード形状の推測ではなく閉じたタグ集合で分岐するため
 */
package com.example.conversion.service.dispatch;

import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformCredentials;
import com.example.conversion.service.ConversionMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DispatchRouter {

  private final MetaConversionsAdapter metaAdapter;
  private final GoogleMeasurementAdapter googleAdapter;
  private final TikTokEventsAdapter tiktokAdapter;
  private final PinterestConversionsAdapter pinterestAdapter;
  private final ConversionMetrics metrics;
  private final Clock clock;

  public PlatformAdapter adapterFor(Platform platform) {
    return switch (platform) {
      case META -> metaAdapter;
      case GOOGLE -> googleAdapter;
      case TIKTOK -> tiktokAdapter;
      case PINTEREST -> pinterestAdapter;
    };
  }

  public DeliveryResult dispatch(ConversionEvent event, PlatformCredentials credentials) {
    final Instant startedAt = Instant.now(clock);
    final DeliveryResult result = adapterFor(credentials.platform()).send(event, credentials);
    metrics.recordDelivery(
        credentials.platform().wireName(),
        result.ok() ? "ok" : "fail",
        Duration.between(startedAt, Instant.now(clock)));
    return result;
  }
}
