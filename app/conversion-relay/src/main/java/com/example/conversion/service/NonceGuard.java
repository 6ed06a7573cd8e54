/*
 * どこで: Conversion Relay リプレイ対策
 * 何を: (shop, eventType, orderKey, nonce) を 1 回だけ消費できるようにし、記録失敗時は解放する
 * なぜ: 時刻窓内の同一リクエスト再送を重複配信につなげず、失敗後の再送は受け付けるため
 */
package com.example.conversion.service;

import com.example.conversion.config.IngestProperties;
import com.example.conversion.repository.EventNonceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NonceGuard {

  private static final Logger logger = LoggerFactory.getLogger(NonceGuard.class);

  private final SharedStore sharedStore;
  private final EventNonceRepository eventNonceRepository;
  private final IngestProperties properties;
  private final Clock clock;

  /** 初回なら true、既に消費済み（リプレイ）なら false。 */
  public boolean consume(UUID shopId, String eventType, String orderKey, String nonce) {
    final String key = key(shopId, eventType, orderKey, nonce);
    try {
      return sharedStore.setIfAbsent(key, "1", properties.nonceTtl());
    } catch (DataAccessException ex) {
      // 共有ストア不達時は DB の一意制約で代替する
      logger.warn("nonce store unavailable, falling back to database shopId={}", shopId, ex);
      final Instant now = Instant.now(clock);
      return eventNonceRepository.insertIfAbsent(shopId, key, now, now.plus(properties.nonceTtl()));
    }
  }

  /**
   * 消費済みの nonce を戻す。記録に失敗したイベントの再送を受け付けるために使う。
   *
   * <p>どちらの保存先で消費したかは区別せず両方から消す。解放自体の失敗はログに残し、呼び出し元の
   * 本来の例外を優先する。
   */
  public void release(UUID shopId, String eventType, String orderKey, String nonce) {
    final String key = key(shopId, eventType, orderKey, nonce);
    try {
      sharedStore.delete(key);
    } catch (DataAccessException ex) {
      logger.warn("nonce release failed on shared store shopId={}", shopId, ex);
    }
    try {
      eventNonceRepository.delete(shopId, key);
    } catch (DataAccessException ex) {
      logger.warn("nonce release failed on database shopId={}", shopId, ex);
    }
  }

  private static String key(UUID shopId, String eventType, String orderKey, String nonce) {
    return "nonce:" + shopId + ":" + eventType + ":" + orderKey + ":" + nonce;
  }
}
