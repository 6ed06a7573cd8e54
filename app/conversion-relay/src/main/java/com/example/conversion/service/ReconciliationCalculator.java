/*
 * どこで: Conversion Relay 突合
 * 何を: 注文の正本と ok 配信試行から、プラットフォーム別の欠落/重複/遅延/金額差を計算する
 * なぜ: 入出力だけで決まる純粋計算に分け、DB なしで検証できるようにするため
 */
package com.example.conversion.service;

import com.example.conversion.model.DeliveryAttempt;
import com.example.conversion.model.OrderSnapshot;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformReconciliation;
import com.example.conversion.model.ReconciliationReport;
import com.example.conversion.model.Severity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public final class ReconciliationCalculator {

  private final Duration delayThreshold;

  public ReconciliationCalculator(Duration delayThreshold) {
    this.delayThreshold = delayThreshold;
  }

  public ReconciliationReport calculate(
      UUID shopId,
      Instant from,
      Instant to,
      List<OrderSnapshot> orders,
      List<Platform> platforms,
      List<DeliveryAttempt> okAttempts) {
    // 注文キー -> 正本。同じ注文が複数行あっても 1 件として数える
    final Map<String, OrderSnapshot> byKey = new HashMap<>();
    final Set<String> orderKeys = new LinkedHashSet<>();
    for (OrderSnapshot order : orders) {
      final String key = OrderKeys.normalizeOrderId(order.orderId());
      if (orderKeys.add(key)) {
        byKey.put(key, order);
      }
    }

    final Map<Platform, Map<String, List<DeliveryAttempt>>> attemptsByPlatform = new HashMap<>();
    for (DeliveryAttempt attempt : okAttempts) {
      if (!byKey.containsKey(attempt.orderKey())) {
        continue;
      }
      attemptsByPlatform
          .computeIfAbsent(attempt.platform(), ignored -> new HashMap<>())
          .computeIfAbsent(attempt.orderKey(), ignored -> new ArrayList<>())
          .add(attempt);
    }

    final List<String> systemicGaps = new ArrayList<>();
    if (!platforms.isEmpty()) {
      for (String key : orderKeys) {
        final boolean missingEverywhere =
            platforms.stream()
                .noneMatch(
                    platform ->
                        attemptsByPlatform.getOrDefault(platform, Map.of()).containsKey(key));
        if (missingEverywhere) {
          systemicGaps.add(key);
        }
      }
    }
    final Set<String> systemic = new LinkedHashSet<>(systemicGaps);

    final List<PlatformReconciliation> results = new ArrayList<>();
    for (Platform platform : platforms) {
      results.add(
          forPlatform(
              platform,
              orderKeys,
              byKey,
              attemptsByPlatform.getOrDefault(platform, Map.of()),
              systemic));
    }
    final Severity systemicSeverity =
        Severity.forMissingRate(ratio(systemicGaps.size(), orderKeys.size()));
    return new ReconciliationReport(shopId, from, to, results, systemicGaps, systemicSeverity);
  }

  private PlatformReconciliation forPlatform(
      Platform platform,
      Set<String> orderKeys,
      Map<String, OrderSnapshot> byKey,
      Map<String, List<DeliveryAttempt>> attemptsByOrder,
      Set<String> systemic) {
    final int source = orderKeys.size();
    int matched = 0;
    BigDecimal sourceValue = BigDecimal.ZERO;
    BigDecimal deliveredValue = BigDecimal.ZERO;
    final List<String> duplicates = new ArrayList<>();
    final List<String> delayed = new ArrayList<>();
    final List<String> missing = new ArrayList<>();

    for (String key : orderKeys) {
      final OrderSnapshot order = byKey.get(key);
      sourceValue = sourceValue.add(orZero(order.value()));
      final List<DeliveryAttempt> attempts = attemptsByOrder.get(key);
      if (attempts == null || attempts.isEmpty()) {
        if (!systemic.contains(key)) {
          missing.add(key);
        }
        continue;
      }
      matched++;
      if (attempts.size() > 1) {
        duplicates.add(key);
      }
      // 最新の ok を正とする
      final DeliveryAttempt latest =
          attempts.stream().max(Comparator.comparing(ReconciliationCalculator::completedAt)).get();
      deliveredValue = deliveredValue.add(orZero(latest.value()));
      if (order.createdAt() != null
          && Duration.between(order.createdAt(), completedAt(latest)).compareTo(delayThreshold) > 0) {
        delayed.add(key);
      }
    }

    final int discrepancy = source - matched;
    final BigDecimal valueDiscrepancy = sourceValue.subtract(deliveredValue).abs();
    final double valueDiscrepancyRate =
        sourceValue.signum() == 0
            ? 0.0d
            : valueDiscrepancy.divide(sourceValue, 6, RoundingMode.HALF_UP).doubleValue();
    final double discrepancyRate = ratio(discrepancy, source);
    return new PlatformReconciliation(
        platform,
        source,
        matched,
        source == 0 ? 0.0d : ratio(matched, source),
        discrepancy,
        discrepancyRate,
        valueDiscrepancy,
        valueDiscrepancyRate,
        duplicates,
        delayed,
        missing,
        Severity.forMissingRate(discrepancyRate));
  }

  private static Instant completedAt(DeliveryAttempt attempt) {
    return attempt.completedAt() != null ? attempt.completedAt() : attempt.attemptedAt();
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value == null ? BigDecimal.ZERO : value;
  }

  private static double ratio(int numerator, int denominator) {
    return denominator == 0 ? 0.0d : (double) numerator / denominator;
  }
}
