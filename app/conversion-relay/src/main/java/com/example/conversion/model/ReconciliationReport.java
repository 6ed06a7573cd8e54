package com.example.conversion.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconciliationReport(
    UUID shopId,
    Instant from,
    Instant to,
    List<PlatformReconciliation> platforms,
    List<String> systemicGaps,
    Severity systemicSeverity) {

  public ReconciliationReport {
    platforms = List.copyOf(platforms);
    systemicGaps = List.copyOf(systemicGaps);
  }
}
