package com.example.conversion.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.List;

/**
 * 1 プラットフォーム分の突合結果。
 *
 * <p>missingOrders は当該プラットフォームだけで欠落した注文で、全プラットフォームで欠落した注文（systemic gap）は含まない。
 * discrepancy はその両方を数える。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlatformReconciliation(
    Platform platform,
    int sourceOrders,
    int matchedOrders,
    double matchRate,
    int discrepancy,
    double discrepancyRate,
    BigDecimal valueDiscrepancy,
    double valueDiscrepancyRate,
    List<String> duplicateOrders,
    List<String> delayedOrders,
    List<String> missingOrders,
    Severity severity) {

  public PlatformReconciliation {
    duplicateOrders = List.copyOf(duplicateOrders);
    delayedOrders = List.copyOf(delayedOrders);
    missingOrders = List.copyOf(missingOrders);
  }
}
