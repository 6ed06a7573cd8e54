package com.example.conversion.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** delivery_attempts の 1 行（追記のみ）。 */
public record DeliveryAttempt(
    UUID id,
    UUID receiptId,
    UUID shopId,
    String eventId,
    Platform platform,
    DeliveryStatus status,
    Integer statusCode,
    String error,
    String requestJson,
    String orderKey,
    BigDecimal value,
    String currency,
    Instant attemptedAt,
    Instant completedAt) {}
