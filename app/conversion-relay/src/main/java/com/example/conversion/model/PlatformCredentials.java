package com.example.conversion.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** アダプタへ渡す送信先の認証情報と環境。 */
public record PlatformCredentials(
    Platform platform, PixelEnvironment environment, Map<String, String> values, String region) {

  public PlatformCredentials {
    values = values == null ? Map.of() : Map.copyOf(values);
  }

  public String get(String key) {
    final String value = values.get(key);
    return value == null || value.isBlank() ? null : value;
  }

  public boolean testMode() {
    return environment == PixelEnvironment.TEST;
  }

  public List<String> missing(List<String> requiredKeys) {
    final List<String> missing = new ArrayList<>();
    for (String key : requiredKeys) {
      if (get(key) == null) {
        missing.add(key);
      }
    }
    return missing;
  }
}
