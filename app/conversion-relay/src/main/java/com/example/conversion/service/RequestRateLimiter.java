package com.example.conversion.service;

import com.example.conversion.config.IngestProperties;
import java.time.Clock;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** ショップ単位・1 分窓の固定ウィンドウ制限。 */
@Service
@RequiredArgsConstructor
public class RequestRateLimiter {

  private static final Logger logger = LoggerFactory.getLogger(RequestRateLimiter.class);
  private static final Duration BUCKET_TTL = Duration.ofMinutes(2);

  private final SharedStore sharedStore;
  private final IngestProperties properties;
  private final Clock clock;

  public boolean allow(String shopDomain) {
    final long minute = clock.millis() / 60_000L;
    try {
      final long count = sharedStore.increment("ratelimit:" + shopDomain + ":" + minute, BUCKET_TTL);
      return count <= properties.rateLimitPerMinute();
    } catch (DataAccessException ex) {
      // レート制限は保護目的なのでストア障害時は通す
      logger.warn("rate limit store unavailable, allowing request shopDomain={}", shopDomain, ex);
      return true;
    }
  }
}
