package com.example.conversion.api.response;

import com.example.conversion.model.DeliveryAttempt;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** 内部 API 向けの配信試行。request_json は監査用にそのまま返す。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryAttemptResponse(
    UUID id,
    String eventId,
    String platform,
    String status,
    Integer statusCode,
    String error,
    String requestJson,
    String orderKey,
    BigDecimal value,
    String currency,
    Instant attemptedAt,
    Instant completedAt) {

  public static DeliveryAttemptResponse from(DeliveryAttempt attempt) {
    return new DeliveryAttemptResponse(
        attempt.id(),
        attempt.eventId(),
        attempt.platform().wireName(),
        attempt.status().dbValue(),
        attempt.statusCode(),
        attempt.error(),
        attempt.requestJson(),
        attempt.orderKey(),
        attempt.value(),
        attempt.currency(),
        attempt.attemptedAt(),
        attempt.completedAt());
  }
}
