package com.example.conversion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.conversion.model.ConsentState;
import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.DeliveryAttempt;
import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.DeliveryStatus;
import com.example.conversion.model.EventReceipt;
import com.example.conversion.model.LineItem;
import com.example.conversion.model.Platform;
import com.example.conversion.model.TrustLevel;
import com.example.conversion.repository.DeliveryAttemptRepository;
import com.example.conversion.repository.EventReceiptRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeliveryLedgerTest {

  private static final Instant NOW = Instant.parse("2026-10-19T09:00:02Z");
  private static final UUID SHOP_ID = UUID.fromString("8a5c1d2e-3f40-4b5c-9d6e-7f8091a2b3c4");

  @Mock private EventReceiptRepository eventReceiptRepository;
  @Mock private DeliveryAttemptRepository deliveryAttemptRepository;

  private DeliveryLedger ledger;

  @BeforeEach
  void setUp() {
    ledger =
        new DeliveryLedger(
            eventReceiptRepository, deliveryAttemptRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void duplicateReceiptIsReportedAsNotRecorded() {
    final EventReceipt receipt =
        new EventReceipt(
            UUID.randomUUID(),
            SHOP_ID,
            "evt-1",
            "purchase",
            "1001",
            null,
            "demo.myshopify.com",
            "meta",
            TrustLevel.TRUSTED,
            true,
            null,
            null,
            null,
            NOW);
    when(eventReceiptRepository.insertIfAbsent(receipt)).thenReturn(true, false);

    assertThat(ledger.recordReceipt(receipt)).isTrue();
    assertThat(ledger.recordReceipt(receipt)).isFalse();
  }

  @Test
  void attemptCarriesOrderValueAndResult() {
    final UUID receiptId = UUID.randomUUID();
    final ConversionEvent event =
        new ConversionEvent(
            "evt-1",
            "purchase",
            "demo.myshopify.com",
            "1001",
            "tok-1",
            "1001",
            "tok-1",
            Instant.parse("2026-10-19T09:00:00Z"),
            new BigDecimal("19.90"),
            "USD",
            List.of(new LineItem("v-1", 1)),
            ConsentState.NONE);
    final Instant attemptedAt = Instant.parse("2026-10-19T09:00:01Z");

    final DeliveryAttempt attempt =
        ledger.recordAttempt(
            receiptId,
            SHOP_ID,
            event,
            Platform.TIKTOK,
            DeliveryStatus.FAIL,
            DeliveryResult.failure(500, "http_500", "{}"),
            attemptedAt);

    final ArgumentCaptor<DeliveryAttempt> captor = ArgumentCaptor.forClass(DeliveryAttempt.class);
    verify(deliveryAttemptRepository).insert(captor.capture());
    assertThat(captor.getValue()).isEqualTo(attempt);
    assertThat(attempt.receiptId()).isEqualTo(receiptId);
    assertThat(attempt.eventId()).isEqualTo("evt-1");
    assertThat(attempt.orderKey()).isEqualTo("1001");
    assertThat(attempt.value()).isEqualByComparingTo("19.90");
    assertThat(attempt.statusCode()).isEqualTo(500);
    assertThat(attempt.error()).isEqualTo("http_500");
    assertThat(attempt.attemptedAt()).isEqualTo(attemptedAt);
    assertThat(attempt.completedAt()).isEqualTo(NOW);
  }
}
