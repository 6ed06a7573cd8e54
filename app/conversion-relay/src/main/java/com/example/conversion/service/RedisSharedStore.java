package com.example.conversion.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import org.springframework.data.redis.core.StringRedisTemplate;

public class RedisSharedStore implements SharedStore {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final String keyPrefix;

  public RedisSharedStore(StringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    final Boolean stored = redisTemplate.opsForValue().setIfAbsent(keyPrefix + key, value, ttl);
    return Boolean.TRUE.equals(stored);
  }

  @Override
  public long increment(String key, Duration ttl) {
    final String fullKey = keyPrefix + key;
    final Long value = redisTemplate.opsForValue().increment(fullKey);
    final long current = value == null ? 0L : value;
    if (current == 1L) {
      redisTemplate.expire(fullKey, ttl);
    }
    return current;
  }

  @Override
  public boolean exists(String key) {
    return Boolean.TRUE.equals(redisTemplate.hasKey(keyPrefix + key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redisTemplate.opsForValue().set(keyPrefix + key, value, ttl);
  }

  @Override
  public void delete(String key) {
    redisTemplate.delete(keyPrefix + key);
  }
}
