/*
 * どこで: Conversion Relay ドメインモデル
 * 何を: shops テーブルのスナップショット
 * なぜ: 署名検証とオリジン判定に必要なショップ情報をまとめるため
 */
package com.example.conversion.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record Shop(
    UUID id,
    String shopDomain,
    String primaryDomain,
    List<String> storefrontDomains,
    String ingestionSecret,
    String previousIngestionSecret,
    Instant previousSecretExpiresAt,
    TrackingMode trackingMode,
    boolean active) {

  public Shop {
    storefrontDomains = storefrontDomains == null ? List.of() : List.copyOf(storefrontDomains);
  }

  /** 旧シークレットが猶予期間内で有効か。 */
  public boolean previousSecretUsable(Instant now) {
    if (previousIngestionSecret == null || previousIngestionSecret.isBlank()) {
      return false;
    }
    return previousSecretExpiresAt == null || now.isBefore(previousSecretExpiresAt);
  }
}
