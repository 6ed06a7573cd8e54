package com.example.conversion.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** event_receipts の 1 行。(shopId, eventId) で一意。 */
public record EventReceipt(
    UUID id,
    UUID shopId,
    String eventId,
    String eventType,
    String orderKey,
    String altOrderKey,
    String originHost,
    String platforms,
    TrustLevel trustLevel,
    boolean signatureMatched,
    String consentJson,
    BigDecimal value,
    String currency,
    Instant createdAt) {}
