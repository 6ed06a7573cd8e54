/*
 * どこで: Conversion Relay 突合
 * 何を: 注文の正本と台帳を読み込み、ショップ単位/全ショップの突合を実行する
 * なぜ: 配信漏れをプラットフォーム別に検知するため
 */
package com.example.conversion.service;

import com.example.conversion.config.TaskProperties;
import com.example.conversion.model.OrderSnapshot;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformConfig;
import com.example.conversion.model.ReconciliationReport;
import com.example.conversion.model.Severity;
import com.example.conversion.model.Shop;
import com.example.conversion.repository.OrderSnapshotRepository;
import com.example.conversion.repository.PlatformConfigRepository;
import com.example.conversion.repository.ShopRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class ReconciliationService {

  private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

  private final ShopRepository shopRepository;
  private final PlatformConfigRepository platformConfigRepository;
  private final OrderSnapshotRepository orderSnapshotRepository;
  private final DeliveryLedger ledger;
  private final TaskProperties properties;
  private final Clock clock;
  private final ReconciliationCalculator calculator;

  public ReconciliationService(
      ShopRepository shopRepository,
      PlatformConfigRepository platformConfigRepository,
      OrderSnapshotRepository orderSnapshotRepository,
      DeliveryLedger ledger,
      TaskProperties properties,
      Clock clock) {
    this.shopRepository = shopRepository;
    this.platformConfigRepository = platformConfigRepository;
    this.orderSnapshotRepository = orderSnapshotRepository;
    this.ledger = ledger;
    this.properties = properties;
    this.clock = clock;
    this.calculator = new ReconciliationCalculator(properties.timingDelayThreshold());
  }

  public ReconciliationReport reconcile(UUID shopId, Instant from, Instant to) {
    if (!from.isBefore(to)) {
      throw new IllegalArgumentException("from must be before to");
    }
    final List<Platform> platforms =
        platformConfigRepository.findActiveByShop(shopId).stream()
            .filter(PlatformConfig::serverSideEnabled)
            .map(PlatformConfig::platform)
            .toList();
    final List<OrderSnapshot> orders = orderSnapshotRepository.findByShopAndWindow(shopId, from, to);
    final Set<String> orderKeys = new LinkedHashSet<>();
    for (OrderSnapshot order : orders) {
      orderKeys.add(OrderKeys.normalizeOrderId(order.orderId()));
    }
    return calculator.calculate(
        shopId, from, to, orders, platforms, ledger.okAttemptsForOrders(shopId, orderKeys));
  }

  /** 直近 reconciliation-window の突合を全アクティブショップに対して行う。 */
  public Map<String, Object> runForAllShops() {
    final Instant to = Instant.now(clock);
    final Instant from = to.minus(properties.reconciliationWindow());
    int shops = 0;
    int failedShops = 0;
    int systemicGaps = 0;
    int criticalShops = 0;
    for (Shop shop : shopRepository.findAllActive()) {
      shops++;
      try {
        final ReconciliationReport report = reconcile(shop.id(), from, to);
        systemicGaps += report.systemicGaps().size();
        final boolean critical =
            report.systemicSeverity() == Severity.CRITICAL
                || report.platforms().stream().anyMatch(p -> p.severity() == Severity.CRITICAL);
        if (critical) {
          criticalShops++;
          logger.warn(
              "reconciliation critical shopId={} systemicGaps={} from={} to={}",
              shop.id(),
              report.systemicGaps().size(),
              from,
              to);
        }
      } catch (DataAccessException ex) {
        // 1 ショップの失敗で残りを止めない
        failedShops++;
        logger.error("reconciliation failed shopId={}", shop.id(), ex);
      }
    }
    final Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("shops", shops);
    summary.put("failed_shops", failedShops);
    summary.put("critical_shops", criticalShops);
    summary.put("systemic_gaps", systemicGaps);
    logger.info(
        "reconciliation completed shops={} failed={} critical={} systemicGaps={}",
        shops,
        failedShops,
        criticalShops,
        systemicGaps);
    return summary;
  }
}
