package com.example.conversion.model;

import java.time.Instant;
import java.util.UUID;

public record DispatchJob(
    UUID id,
    UUID receiptId,
    UUID shopId,
    Platform platform,
    String payloadJson,
    String status,
    int attemptCount,
    Instant nextRetryAt,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt) {}
