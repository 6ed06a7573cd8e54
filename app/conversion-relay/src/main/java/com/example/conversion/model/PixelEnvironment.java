package com.example.conversion.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum PixelEnvironment {
  TEST,
  LIVE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<PixelEnvironment> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (PixelEnvironment environment : values()) {
      if (environment.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(environment);
      }
    }
    return Optional.empty();
  }
}
