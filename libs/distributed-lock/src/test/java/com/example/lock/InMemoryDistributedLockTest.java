package com.example.lock;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryDistributedLockTest {

  private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
  private static final Duration TTL = Duration.ofSeconds(30);

  @Test
  void concurrentAcquireYieldsExactlyOneWinner() throws Exception {
    final InMemoryDistributedLock lock = new InMemoryDistributedLock(new MutableClock(START));
    final ExecutorService pool = Executors.newFixedThreadPool(2);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<LockAcquisition>> futures = new ArrayList<>();
      for (String holder : List.of("holder-a", "holder-b")) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  return lock.acquire("dispatch", holder, TTL);
                }));
      }
      start.countDown();
      final List<LockAcquisition> results = new ArrayList<>();
      for (Future<LockAcquisition> future : futures) {
        results.add(future.get(5, TimeUnit.SECONDS));
      }

      assertThat(results).filteredOn(LockAcquisition::isAcquired).hasSize(1);
      final LockAcquisition loser =
          results.stream().filter(r -> !r.isAcquired()).findFirst().orElseThrow();
      assertThat(loser.outcome()).isEqualTo(LockAcquisition.Outcome.HELD_ELSEWHERE);
      assertThat(loser.remainingTtl()).isPositive();
      assertThat(loser.reason()).startsWith("lock_held");
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void renewedHolderStaysSoleOwnerPastOriginalExpiry() {
    final MutableClock clock = new MutableClock(START);
    final InMemoryDistributedLock lock = new InMemoryDistributedLock(clock);
    assertThat(lock.acquire("cleanup", "holder-a", TTL).isAcquired()).isTrue();

    clock.advance(Duration.ofSeconds(20));
    assertThat(lock.renew("cleanup", "holder-a", TTL)).isTrue();
    clock.advance(Duration.ofSeconds(20));

    final LockAcquisition other = lock.acquire("cleanup", "holder-b", TTL);
    assertThat(other.isAcquired()).isFalse();
    assertThat(other.remainingTtl()).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void expiredLockBecomesAcquirableAndOldHolderCannotRenewOrRelease() {
    final MutableClock clock = new MutableClock(START);
    final InMemoryDistributedLock lock = new InMemoryDistributedLock(clock);
    lock.acquire("cleanup", "holder-a", TTL);

    clock.advance(TTL);

    assertThat(lock.acquire("cleanup", "holder-b", TTL).isAcquired()).isTrue();
    assertThat(lock.renew("cleanup", "holder-a", TTL)).isFalse();
    assertThat(lock.release("cleanup", "holder-a")).isFalse();
    assertThat(lock.release("cleanup", "holder-b")).isTrue();
  }

  @Test
  void releaseByNonOwnerKeepsLock() {
    final InMemoryDistributedLock lock = new InMemoryDistributedLock(new MutableClock(START));
    lock.acquire("reconciliation", "holder-a", TTL);

    assertThat(lock.release("reconciliation", "holder-b")).isFalse();
    assertThat(lock.acquire("reconciliation", "holder-b", TTL).isAcquired()).isFalse();
  }
}
