/*
 * どこで: Conversion Relay の設定バインド
 * 何を: 共有ストア（nonce/レート制限/ロック）の実装選択とキー接頭辞を保持する
 * なぜ: 単一インスタンス開発時だけインメモリ実装へ切り替えるため
 */
package com.example.conversion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "conversion.store")
public record StoreProperties(String mode, String keyPrefix) {

  public static final String MODE_REDIS = "redis";
  public static final String MODE_MEMORY = "memory";

  public StoreProperties {
    mode = mode == null || mode.isBlank() ? MODE_REDIS : mode;
    keyPrefix = keyPrefix == null ? "cr:" : keyPrefix;
  }
}
