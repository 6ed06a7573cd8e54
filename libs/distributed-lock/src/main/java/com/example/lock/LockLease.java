package com.example.lock;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 取得済みロックのスコープ。try-with-resources で使い、どの終了経路でも close() で解放する。
 *
 * <p>生存中は TTL の半分ごとに延長する。延長に失敗した場合は {@link #isLost()} が true になり、以後は延長しない。
 */
public final class LockLease implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(LockLease.class);

  private final DistributedLock lock;
  private final String lockType;
  private final String holderToken;
  private final Duration ttl;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean lost = new AtomicBoolean(false);
  private volatile ScheduledFuture<?> renewal;

  LockLease(DistributedLock lock, String lockType, String holderToken, Duration ttl) {
    this.lock = lock;
    this.lockType = lockType;
    this.holderToken = holderToken;
    this.ttl = ttl;
  }

  void startRenewal(ScheduledExecutorService scheduler) {
    final long periodMillis = Math.max(1L, ttl.toMillis() / 2);
    renewal =
        scheduler.scheduleAtFixedRate(
            this::renewOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
  }

  void renewOnce() {
    if (closed.get() || lost.get()) {
      return;
    }
    if (!lock.renew(lockType, holderToken, ttl)) {
      lost.set(true);
      logger.warn("lock renewal failed, lease lost lockType={} holder={}", lockType, holderToken);
      cancelRenewal();
    }
  }

  public String lockType() {
    return lockType;
  }

  public String holderToken() {
    return holderToken;
  }

  public boolean isLost() {
    return lost.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    cancelRenewal();
    if (!lock.release(lockType, holderToken)) {
      logger.info("lock already expired or taken at release lockType={}", lockType);
    }
  }

  private void cancelRenewal() {
    final ScheduledFuture<?> current = renewal;
    if (current != null) {
      current.cancel(false);
    }
  }
}
