/*
 * どこで: Conversion Relay ドメインモデル
 * 何を: 配信試行の状態を表す列挙
 * なぜ: DB の小文字表記と処理ロジックの状態を一致させるため
 */
package com.example.conversion.model;

import java.util.Locale;

public enum DeliveryStatus {
  OK,
  FAIL,
  PENDING,
  RETRYING;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static DeliveryStatus fromDb(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
