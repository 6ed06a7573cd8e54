package com.example.conversion.model;

import java.util.List;

public record ResolvedShop(Shop shop, List<PlatformConfig> platformConfigs) {

  public ResolvedShop {
    platformConfigs = platformConfigs == null ? List.of() : List.copyOf(platformConfigs);
  }
}
