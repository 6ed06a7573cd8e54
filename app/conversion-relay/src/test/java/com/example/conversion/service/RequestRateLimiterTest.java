package com.example.conversion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.conversion.config.IngestProperties;
import com.example.conversion.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class RequestRateLimiterTest {

  private static final IngestProperties PROPERTIES =
      new IngestProperties(null, null, null, null, true, false, true, false, 2, null, null, null, null);

  @Test
  void limitsPerShopWithinOneMinuteWindow() {
    final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T00:00:10Z"));
    final RequestRateLimiter limiter =
        new RequestRateLimiter(new InMemorySharedStore(clock), PROPERTIES, clock);

    assertThat(limiter.allow("a.myshopify.com")).isTrue();
    assertThat(limiter.allow("a.myshopify.com")).isTrue();
    assertThat(limiter.allow("a.myshopify.com")).isFalse();
    assertThat(limiter.allow("b.myshopify.com")).isTrue();

    clock.advance(Duration.ofMinutes(1));
    assertThat(limiter.allow("a.myshopify.com")).isTrue();
  }

  @Test
  void storeFailureFailsOpen() {
    final SharedStore store = mock(SharedStore.class);
    when(store.increment(anyString(), any(Duration.class)))
        .thenThrow(new RedisConnectionFailureException("down"));
    final MutableClock clock = new MutableClock(Instant.EPOCH);

    assertThat(new RequestRateLimiter(store, PROPERTIES, clock).allow("a.myshopify.com")).isTrue();
  }
}
