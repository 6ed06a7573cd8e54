package com.example.conversion.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.conversion.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemorySharedStoreTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T00:00:00Z"));
  private final InMemorySharedStore store = new InMemorySharedStore(clock);

  @Test
  void setIfAbsentSucceedsAgainAfterTtl() {
    assertThat(store.setIfAbsent("k", "1", Duration.ofSeconds(10))).isTrue();
    assertThat(store.setIfAbsent("k", "2", Duration.ofSeconds(10))).isFalse();

    clock.advance(Duration.ofSeconds(10));

    assertThat(store.exists("k")).isFalse();
    assertThat(store.setIfAbsent("k", "3", Duration.ofSeconds(10))).isTrue();
  }

  @Test
  void incrementKeepsTtlOfFirstIncrement() {
    assertThat(store.increment("c", Duration.ofSeconds(60))).isEqualTo(1L);
    clock.advance(Duration.ofSeconds(59));
    assertThat(store.increment("c", Duration.ofSeconds(60))).isEqualTo(2L);

    clock.advance(Duration.ofSeconds(1));

    assertThat(store.increment("c", Duration.ofSeconds(60))).isEqualTo(1L);
  }

  @Test
  void setOverwritesExistingValue() {
    store.set("marker", "a", Duration.ofMinutes(1));

    assertThat(store.exists("marker")).isTrue();
  }
}
