/*
 * どこで: Conversion Relay 受信パイプライン
 * 何を: 同意シグナルとプラットフォーム設定から送信先を絞り込む
 * なぜ: 同意の無い送信先へデータを出さないため（未送信は許可とみなさない）
 */
package com.example.conversion.service;

import com.example.conversion.model.ConsentState;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformConfig;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConsentFilter {

  static final String SERVER_SIDE_DISABLED = "server_side_disabled";
  static final String SALE_OF_DATA_NOT_GRANTED = "sale_of_data_not_granted";
  static final String MARKETING_NOT_GRANTED = "marketing_not_granted";
  static final String ANALYTICS_NOT_GRANTED = "analytics_not_granted";

  private final ConversionMetrics metrics;

  /**
   * serverSideEnabled かつ（marketing が true、または treatAsMarketing でない設定で analytics が true）なら含める。
   * saleOfData を要するプラットフォームは saleOfData が明示的に true の場合に限る。
   */
  public ConsentDecision evaluate(ConsentState consent, List<PlatformConfig> configs) {
    final List<PlatformConfig> included = new ArrayList<>();
    final Map<Platform, String> skipped = new EnumMap<>(Platform.class);
    for (PlatformConfig config : configs) {
      final String reason = exclusionReason(consent, config);
      if (reason == null) {
        included.add(config);
      } else {
        skipped.put(config.platform(), reason);
        metrics.recordConsentSkipped(config.platform().wireName(), reason);
      }
    }
    return new ConsentDecision(included, skipped);
  }

  private String exclusionReason(ConsentState consent, PlatformConfig config) {
    if (!config.serverSideEnabled()) {
      return SERVER_SIDE_DISABLED;
    }
    if (config.platform().requiresSaleOfData() && !consent.saleOfDataGranted()) {
      return SALE_OF_DATA_NOT_GRANTED;
    }
    if (consent.marketingGranted()) {
      return null;
    }
    if (config.treatAsMarketing()) {
      return MARKETING_NOT_GRANTED;
    }
    return consent.analyticsGranted() ? null : ANALYTICS_NOT_GRANTED;
  }

  public record ConsentDecision(List<PlatformConfig> included, Map<Platform, String> skipped) {

    public ConsentDecision {
      included = List.copyOf(included);
      skipped = Map.copyOf(skipped);
    }
  }
}
