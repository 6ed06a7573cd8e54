package com.example.conversion.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/** /api/cron の応答。外部スケジューラが読むキー名（camelCase）に合わせる。 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEnvelope(
    String requestId,
    String task,
    long durationMs,
    Map<String, Object> result,
    String reason,
    Long remainingMs) {}
