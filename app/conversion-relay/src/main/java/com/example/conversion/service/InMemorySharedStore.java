/*
 * どこで: Conversion Relay の共有ストア（単一インスタンス用）
 * 何を: Redis 実装と同じ契約をプロセス内 Map で提供する
 * なぜ: Redis の無い開発環境でも同じ受信パイプラインを動かすため
 */
package com.example.conversion.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public class InMemorySharedStore implements SharedStore {

  private final Clock clock;
  private final Map<String, Entry> entries = new HashMap<>();

  public InMemorySharedStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
    final Instant now = clock.instant();
    if (live(key, now) != null) {
      return false;
    }
    entries.put(key, new Entry(value, now.plus(ttl)));
    return true;
  }

  @Override
  public synchronized long increment(String key, Duration ttl) {
    final Instant now = clock.instant();
    final Entry current = live(key, now);
    if (current == null) {
      entries.put(key, new Entry("1", now.plus(ttl)));
      return 1L;
    }
    final long next = Long.parseLong(current.value()) + 1L;
    entries.put(key, new Entry(Long.toString(next), current.expiresAt()));
    return next;
  }

  @Override
  public synchronized boolean exists(String key) {
    return live(key, clock.instant()) != null;
  }

  @Override
  public synchronized void set(String key, String value, Duration ttl) {
    entries.put(key, new Entry(value, clock.instant().plus(ttl)));
  }

  @Override
  public synchronized void delete(String key) {
    entries.remove(key);
  }

  private Entry live(String key, Instant now) {
    final Entry entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    if (!now.isBefore(entry.expiresAt())) {
      entries.remove(key);
      return null;
    }
    return entry;
  }

  private record Entry(String value, Instant expiresAt) {}
}
