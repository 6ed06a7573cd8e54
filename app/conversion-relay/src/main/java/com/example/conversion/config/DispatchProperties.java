/*
 * どこで: Conversion Relay の設定バインド
 * 何を: 各プラットフォームの送信先 URL とタイムアウト、非同期配信のリトライ設定を保持する
 * なぜ: 送信先やバックオフを運用で調整できるようにするため
 */
package com.example.conversion.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "conversion.dispatch")
public record DispatchProperties(
    Duration timeout,
    boolean workerEnabled,
    Duration pollInterval,
    int batchSize,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    Duration lease,
    int errorMessageMaxLength,
    String metaBaseUrl,
    String googleUrl,
    String googleEuUrl,
    String tiktokUrl,
    String pinterestBaseUrl) {

  public DispatchProperties {
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    pollInterval = pollInterval == null ? Duration.ofSeconds(5) : pollInterval;
    batchSize = batchSize <= 0 ? 50 : batchSize;
    maxAttempts = maxAttempts <= 0 ? 5 : maxAttempts;
    backoffBase = backoffBase == null ? Duration.ofSeconds(2) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofMinutes(10) : backoffMax;
    backoffExponentBase = backoffExponentBase <= 0 ? 2.0d : backoffExponentBase;
    backoffJitterMin = backoffJitterMin <= 0 ? 0.5d : backoffJitterMin;
    backoffJitterMax = backoffJitterMax <= 0 ? 1.5d : backoffJitterMax;
    backoffMin = backoffMin == null ? Duration.ofSeconds(1) : backoffMin;
    lease = lease == null ? Duration.ofSeconds(60) : lease;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 500 : errorMessageMaxLength;
    metaBaseUrl = blankToDefault(metaBaseUrl, "https://graph.facebook.com");
    googleUrl = blankToDefault(googleUrl, "https://www.google-analytics.com/mp/collect");
    googleEuUrl = blankToDefault(googleEuUrl, "https://region1.google-analytics.com/mp/collect");
    tiktokUrl =
        blankToDefault(tiktokUrl, "https://business-api.tiktok.com/open_api/v1.3/event/track/");
    pinterestBaseUrl = blankToDefault(pinterestBaseUrl, "https://api.pinterest.com");
  }

  private static String blankToDefault(String value, String defaultValue) {
    return value == null || value.isBlank() ? defaultValue : value;
  }
}
