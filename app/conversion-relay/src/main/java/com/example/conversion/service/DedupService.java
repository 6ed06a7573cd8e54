/*
 * どこで: Conversion Relay 重複排除
 * 何を: 既存レシートとバッチ内重複を事前に除外する
 * なぜ: 同一注文の再送を配信前に no-op にするため（最終判定は一意制約）
 */
package com.example.conversion.service;

import com.example.conversion.model.ConversionEvent;
import com.example.conversion.repository.EventReceiptRepository;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DedupService {

  private final EventReceiptRepository eventReceiptRepository;

  public DedupDecision filter(UUID shopId, List<ConversionEvent> events) {
    final Set<String> purchaseKeys = new LinkedHashSet<>();
    for (ConversionEvent event : events) {
      if (event.purchase()) {
        purchaseKeys.add(event.orderKey());
        if (event.altOrderKey() != null) {
          purchaseKeys.add(event.altOrderKey());
        }
      }
    }
    final Set<String> recorded = eventReceiptRepository.findRecordedPurchaseKeys(shopId, purchaseKeys);

    final List<ConversionEvent> fresh = new ArrayList<>();
    final List<ConversionEvent> duplicates = new ArrayList<>();
    final Set<String> seenEventIds = new HashSet<>();
    final Set<String> seenPurchaseKeys = new HashSet<>();
    for (ConversionEvent event : events) {
      if (!seenEventIds.add(event.eventId())) {
        duplicates.add(event);
        continue;
      }
      if (event.purchase()) {
        final boolean already =
            recorded.contains(event.orderKey())
                || (event.altOrderKey() != null && recorded.contains(event.altOrderKey()))
                || seenPurchaseKeys.contains(event.orderKey())
                || (event.altOrderKey() != null && seenPurchaseKeys.contains(event.altOrderKey()));
        if (already) {
          duplicates.add(event);
          continue;
        }
        seenPurchaseKeys.add(event.orderKey());
        if (event.altOrderKey() != null) {
          seenPurchaseKeys.add(event.altOrderKey());
        }
      }
      fresh.add(event);
    }
    return new DedupDecision(fresh, duplicates);
  }

  public record DedupDecision(List<ConversionEvent> fresh, List<ConversionEvent> duplicates) {

    public DedupDecision {
      fresh = List.copyOf(fresh);
      duplicates = List.copyOf(duplicates);
    }
  }
}
