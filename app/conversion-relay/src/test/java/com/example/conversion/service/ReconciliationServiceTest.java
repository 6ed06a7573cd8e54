package com.example.conversion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.conversion.config.TaskProperties;
import com.example.conversion.model.DeliveryAttempt;
import com.example.conversion.model.DeliveryStatus;
import com.example.conversion.model.OrderSnapshot;
import com.example.conversion.model.PixelEnvironment;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformConfig;
import com.example.conversion.model.PlatformReconciliation;
import com.example.conversion.model.ReconciliationReport;
import com.example.conversion.model.Severity;
import com.example.conversion.model.Shop;
import com.example.conversion.model.TrackingMode;
import com.example.conversion.repository.OrderSnapshotRepository;
import com.example.conversion.repository.PlatformConfigRepository;
import com.example.conversion.repository.ShopRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
  private static final Instant FROM = NOW.minus(Duration.ofHours(24));
  private static final UUID SHOP_A = UUID.fromString("8a5c1d2e-3f40-4b5c-9d6e-7f8091a2b3c4");
  private static final UUID SHOP_B = UUID.fromString("00000000-0000-4000-8000-0000000000bb");

  @Mock private ShopRepository shopRepository;
  @Mock private PlatformConfigRepository platformConfigRepository;
  @Mock private OrderSnapshotRepository orderSnapshotRepository;
  @Mock private DeliveryLedger ledger;

  private ReconciliationService service;

  @BeforeEach
  void setUp() {
    final TaskProperties properties =
        new TaskProperties(
            null, null, true, null, null, 0, null, Duration.ofHours(24), null, 0, null, null);
    service =
        new ReconciliationService(
            shopRepository,
            platformConfigRepository,
            orderSnapshotRepository,
            ledger,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void onlyServerSidePlatformsAreReconciledAgainstNormalizedOrderKeys() {
    givenShopAOrders();

    final ReconciliationReport report = service.reconcile(SHOP_A, FROM, NOW);

    verify(ledger).okAttemptsForOrders(SHOP_A, Set.of("1001", "1002"));
    assertThat(report.platforms())
        .extracting(PlatformReconciliation::platform)
        .containsExactly(Platform.META);
    assertThat(report.platforms().get(0).matchedOrders()).isEqualTo(1);
    assertThat(report.systemicGaps()).containsExactly("1002");
    assertThat(report.systemicSeverity()).isEqualTo(Severity.CRITICAL);
  }

  @Test
  void invertedWindowIsRejected() {
    assertThatThrownBy(() -> service.reconcile(SHOP_A, NOW, FROM))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("from must be before to");
    verifyNoInteractions(orderSnapshotRepository, ledger);
  }

  @Test
  void allShopsRunContinuesPastFailingShop() {
    when(shopRepository.findAllActive()).thenReturn(List.of(shop(SHOP_A), shop(SHOP_B)));
    givenShopAOrders();
    when(platformConfigRepository.findActiveByShop(SHOP_B)).thenReturn(List.of());
    when(orderSnapshotRepository.findByShopAndWindow(eq(SHOP_B), any(), any()))
        .thenThrow(new QueryTimeoutException("timeout"));

    final Map<String, Object> summary = service.runForAllShops();

    assertThat(summary)
        .containsEntry("shops", 2)
        .containsEntry("failed_shops", 1)
        .containsEntry("critical_shops", 1)
        .containsEntry("systemic_gaps", 1);
    verify(orderSnapshotRepository).findByShopAndWindow(SHOP_A, FROM, NOW);
  }

  private void givenShopAOrders() {
    when(platformConfigRepository.findActiveByShop(SHOP_A))
        .thenReturn(List.of(config(Platform.META, true), config(Platform.GOOGLE, false)));
    when(orderSnapshotRepository.findByShopAndWindow(SHOP_A, FROM, NOW))
        .thenReturn(
            List.of(
                new OrderSnapshot(
                    SHOP_A, "gid://shopify/Order/1001", new BigDecimal("10.00"), "USD", FROM),
                new OrderSnapshot(
                    SHOP_A, "gid://shopify/Order/1002", new BigDecimal("5.00"), "USD", FROM)));
    when(ledger.okAttemptsForOrders(eq(SHOP_A), any()))
        .thenReturn(
            List.of(
                new DeliveryAttempt(
                    UUID.randomUUID(),
                    UUID.randomUUID(),
                    SHOP_A,
                    "evt-1",
                    Platform.META,
                    DeliveryStatus.OK,
                    200,
                    null,
                    "{}",
                    "1001",
                    new BigDecimal("10.00"),
                    "USD",
                    FROM.plusSeconds(1),
                    FROM.plusSeconds(2))));
  }

  private static Shop shop(UUID id) {
    return new Shop(
        id,
        id + ".myshopify.com",
        null,
        List.of(),
        "secret",
        null,
        null,
        TrackingMode.PURCHASE_ONLY,
        true);
  }

  private static PlatformConfig config(Platform platform, boolean serverSide) {
    return new PlatformConfig(
        UUID.randomUUID(),
        SHOP_A,
        platform,
        PixelEnvironment.LIVE,
        1,
        serverSide,
        true,
        false,
        null,
        Map.of(),
        null,
        false,
        true,
        NOW);
  }
}
