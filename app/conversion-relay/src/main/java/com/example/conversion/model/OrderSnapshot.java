package com.example.conversion.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** 外部から供給される注文の正本。突合でのみ読む。 */
public record OrderSnapshot(
    UUID shopId, String orderId, BigDecimal value, String currency, Instant createdAt) {}
