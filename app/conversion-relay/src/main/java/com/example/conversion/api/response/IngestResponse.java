package com.example.conversion.api.response;

import com.example.conversion.model.IngestOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestResponse(String requestId, String status, List<EventSummary> events) {

  public static IngestResponse from(String requestId, IngestOutcome outcome) {
    return new IngestResponse(
        requestId,
        outcome.status().name().toLowerCase(Locale.ROOT),
        outcome.events().stream().map(EventSummary::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record EventSummary(
      String eventId,
      String eventType,
      String disposition,
      List<String> platforms,
      Map<String, String> skipped,
      Map<String, String> deliveries) {

    static EventSummary from(IngestOutcome.EventResult result) {
      return new EventSummary(
          result.eventId(),
          result.eventType(),
          result.disposition().name().toLowerCase(Locale.ROOT),
          result.platforms(),
          result.skipped(),
          result.deliveries());
    }
  }
}
