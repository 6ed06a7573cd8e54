/*
 * どこで: Conversion Relay ドメインモデル
 * 何を: platform_configs テーブルのスナップショット
 * なぜ: 同意判定/送信/環境切替で同じ設定値を参照するため
 */
package com.example.conversion.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PlatformConfig(
    UUID id,
    UUID shopId,
    Platform platform,
    PixelEnvironment environment,
    int configVersion,
    boolean serverSideEnabled,
    boolean clientSideEnabled,
    boolean treatAsMarketing,
    String region,
    Map<String, String> credentials,
    String previousConfigJson,
    boolean rollbackAllowed,
    boolean active,
    Instant updatedAt) {

  public PlatformConfig {
    credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
  }

  public PlatformCredentials toCredentials() {
    return new PlatformCredentials(platform, environment, credentials, region);
  }
}
