/*
 * どこで: Conversion Relay の共有ストア抽象
 * 何を: nonce 消費/レート制限/実行マーカーに使う原子的なキー操作を定義する
 * なぜ: インスタンス間で「既に起きたか」を判定する唯一の場所にするため
 */
package com.example.conversion.service;

import java.time.Duration;

/**
 * インスタンス間で共有されるキー値ストア。
 *
 * <p>Redis 実装ではストア不達時に {@link org.springframework.dao.DataAccessException} を送出する。
 * 呼び出し側がフォールバック方針（永続化へ退避、fail-open、fail-closed）を決める。
 */
public interface SharedStore {

  /** キーが無い場合のみ TTL 付きで書き込み、書き込めたら true。 */
  boolean setIfAbsent(String key, String value, Duration ttl);

  /** カウンタを加算し加算後の値を返す。最初の加算時にだけ TTL を設定する。 */
  long increment(String key, Duration ttl);

  boolean exists(String key);

  void set(String key, String value, Duration ttl);

  void delete(String key);
}
