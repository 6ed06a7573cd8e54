/*
 * どこで: 分散ロックライブラリ
 * 何を: インスタンス ID の解決、リース生成、延長スケジューラの管理を行う
 * なぜ: ジョブ側はロック種別と TTL だけ意識すればよいようにするため
 */
package com.example.lock;

import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LockManager implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(LockManager.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final DistributedLock lock;
  private final ScheduledExecutorService scheduler;
  private final String instanceId;

  public LockManager(DistributedLock lock) {
    this(lock, newRenewalScheduler(), resolveInstanceId());
  }

  @VisibleForTesting
  LockManager(DistributedLock lock, ScheduledExecutorService scheduler, String instanceId) {
    this.lock = lock;
    this.scheduler = scheduler;
    this.instanceId = instanceId;
  }

  public String instanceId() {
    return instanceId;
  }

  public LeaseResult tryLease(String lockType, String holderToken, Duration ttl) {
    final LockAcquisition acquisition = lock.acquire(lockType, holderToken, ttl);
    if (!acquisition.isAcquired()) {
      logger.debug(
          "lock not acquired lockType={} outcome={} reason={}",
          lockType,
          acquisition.outcome(),
          acquisition.reason());
      return new LeaseResult(acquisition, null);
    }
    final LockLease lease = new LockLease(lock, lockType, holderToken, ttl);
    lease.startRenewal(scheduler);
    return new LeaseResult(acquisition, lease);
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }

  @VisibleForTesting
  static String resolveInstanceId() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  private static ScheduledExecutorService newRenewalScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        runnable -> {
          final Thread thread = new Thread(runnable, "lock-renewal");
          thread.setDaemon(true);
          return thread;
        });
  }

  /** lease は取得できた場合のみ non-null。 */
  public record LeaseResult(LockAcquisition acquisition, LockLease lease) {
    public boolean acquired() {
      return lease != null;
    }
  }
}
