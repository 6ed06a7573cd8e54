/*
 * どこで: 分散ロックライブラリ（単一インスタンス用）
 * 何を: Redis 実装と同じ契約をプロセス内 Map で提供する
 * なぜ: 共有ストアを持たない開発環境/単一インスタンス構成でも同じコードパスを使うため
 */
package com.example.lock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public class InMemoryDistributedLock implements DistributedLock {

  private final Clock clock;
  private final Map<String, Holder> holders = new HashMap<>();

  public InMemoryDistributedLock(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized LockAcquisition acquire(String lockType, String holderToken, Duration ttl) {
    final Instant now = clock.instant();
    final Holder current = live(lockType, now);
    if (current != null) {
      return LockAcquisition.heldElsewhere(
          Duration.ofMillis(Math.max(1L, Duration.between(now, current.expiresAt()).toMillis())));
    }
    holders.put(lockType, new Holder(holderToken, now.plus(ttl)));
    return LockAcquisition.acquired(ttl);
  }

  @Override
  public synchronized boolean release(String lockType, String holderToken) {
    final Holder current = live(lockType, clock.instant());
    if (current == null || !current.token().equals(holderToken)) {
      return false;
    }
    holders.remove(lockType);
    return true;
  }

  @Override
  public synchronized boolean renew(String lockType, String holderToken, Duration ttl) {
    final Instant now = clock.instant();
    final Holder current = live(lockType, now);
    if (current == null || !current.token().equals(holderToken)) {
      return false;
    }
    holders.put(lockType, new Holder(holderToken, now.plus(ttl)));
    return true;
  }

  private Holder live(String lockType, Instant now) {
    final Holder current = holders.get(lockType);
    if (current == null) {
      return null;
    }
    if (!now.isBefore(current.expiresAt())) {
      holders.remove(lockType);
      return null;
    }
    return current;
  }

  private record Holder(String token, Instant expiresAt) {}
}
