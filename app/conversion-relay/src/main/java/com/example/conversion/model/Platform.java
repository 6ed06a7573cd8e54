/*
 * どこで: Conversion Relay ドメインモデル
 * 何を: 送信先プラットフォームの閉じた集合を表す
 * なぜ: ペイロード整形をタグの網羅 switch で選ぶため
 */
package com.example.conversion.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum Platform {
  META(true, List.of("pixelId", "accessToken")),
  GOOGLE(false, List.of("measurementId", "apiSecret")),
  TIKTOK(true, List.of("pixelId", "accessToken")),
  PINTEREST(true, List.of("adAccountId", "accessToken"));

  private final boolean requiresSaleOfData;
  private final List<String> requiredCredentials;

  Platform(boolean requiresSaleOfData, List<String> requiredCredentials) {
    this.requiresSaleOfData = requiresSaleOfData;
    this.requiredCredentials = requiredCredentials;
  }

  /** live 環境での送信に必須の認証情報キー。 */
  public List<String> requiredCredentials() {
    return requiredCredentials;
  }

  /** 販売/共有への同意（saleOfData）が明示的に true の場合のみ送信できるか。 */
  public boolean requiresSaleOfData() {
    return requiresSaleOfData;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Platform> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (Platform platform : values()) {
      if (platform.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(platform);
      }
    }
    return Optional.empty();
  }
}
