package com.example.conversion.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** 環境切替/ロールバックの結果。検証エラーは missingFields に列挙する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnvironmentSwitchResult(
    boolean success,
    Platform platform,
    PixelEnvironment previousEnvironment,
    PixelEnvironment currentEnvironment,
    Integer configVersion,
    List<String> missingFields,
    String error) {

  public EnvironmentSwitchResult {
    missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
  }

  public static EnvironmentSwitchResult switched(
      Platform platform, PixelEnvironment previous, PixelEnvironment current, int configVersion) {
    return new EnvironmentSwitchResult(true, platform, previous, current, configVersion, null, null);
  }

  public static EnvironmentSwitchResult rejected(
      Platform platform, PixelEnvironment current, String error, List<String> missingFields) {
    return new EnvironmentSwitchResult(false, platform, current, current, null, missingFields, error);
  }
}
