/*
 * どこで: Conversion Relay 認証（署名検証後）
 * 何を: 正しく署名されたバッチの中身から不正利用の兆候（同一注文の連打/不正な注文 ID/非標準イベント）を検出する
 * なぜ: 漏えいした取り込みシークレットでの水増し送信を署名だけでは見分けられないため
 */
package com.example.conversion.service.auth;

import com.example.conversion.model.EventTypes;
import com.example.conversion.model.InboundEvent;
import com.example.conversion.service.OrderKeys;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class BatchAbuseDetector {

  static final int MIN_EVENTS = 3;
  static final double MAX_DUPLICATE_ORDER_RATE = 0.8d;
  static final double MAX_INVALID_ORDER_RATE = 0.3d;
  static final double MAX_NON_STANDARD_EVENT_RATE = 0.5d;

  /**
   * バッチを検査する。
   *
   * <p>重複率は注文 ID を持つイベントだけを分母にする。閲覧系イベントが多いだけのバッチは重複扱いに
   * しない。
   *
   * @return しきい値を超えた指標があれば検出結果、3 件未満または問題なしなら empty
   */
  public Optional<AbuseFinding> inspect(List<InboundEvent> events) {
    final int total = events.size();
    if (total < MIN_EVENTS) {
      return Optional.empty();
    }
    final Set<String> uniqueOrderIds = new HashSet<>();
    int withOrderId = 0;
    int invalidOrderIds = 0;
    int nonStandard = 0;
    for (InboundEvent event : events) {
      if (!EventTypes.isStandard(event.eventName())) {
        nonStandard++;
      }
      final String orderId = event.orderId();
      if (orderId == null || orderId.isEmpty()) {
        continue;
      }
      if (!OrderKeys.isWellFormedOrderId(orderId)) {
        invalidOrderIds++;
        continue;
      }
      withOrderId++;
      uniqueOrderIds.add(orderId);
    }

    final double duplicateRate =
        withOrderId == 0 ? 0d : 1d - (double) uniqueOrderIds.size() / withOrderId;
    final double invalidRate = (double) invalidOrderIds / total;
    final double nonStandardRate = (double) nonStandard / total;

    final List<String> reasons = new ArrayList<>();
    if (duplicateRate > MAX_DUPLICATE_ORDER_RATE) {
      reasons.add(format("high_duplicate_order_keys", duplicateRate));
    }
    if (invalidRate > MAX_INVALID_ORDER_RATE) {
      reasons.add(format("high_invalid_order_keys", invalidRate));
    }
    if (nonStandardRate > MAX_NON_STANDARD_EVENT_RATE) {
      reasons.add(format("high_non_standard_events", nonStandardRate));
    }
    if (reasons.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new AbuseFinding(reasons, total, duplicateRate, invalidRate, nonStandardRate));
  }

  private static String format(String kind, double rate) {
    return kind + ":" + String.format(Locale.ROOT, "%.2f", rate);
  }

  /** reasons は {@code 種別:比率} 形式。メトリクスのタグには kinds() を使う。 */
  public record AbuseFinding(
      List<String> reasons,
      int totalEvents,
      double duplicateOrderRate,
      double invalidOrderRate,
      double nonStandardEventRate) {

    public AbuseFinding {
      reasons = List.copyOf(reasons);
    }

    public List<String> kinds() {
      return reasons.stream().map(reason -> reason.substring(0, reason.indexOf(':'))).toList();
    }
  }
}
