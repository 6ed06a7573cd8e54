/*
 * どこで: Conversion Relay インフラ設定
 * 何を: Redis を使う共有ストアと分散ロックを提供する
 * なぜ: 水平スケール時に nonce とロックを全インスタンスで共有するため
 */
package com.example.conversion.config;

import com.example.conversion.service.RedisSharedStore;
import com.example.conversion.service.SharedStore;
import com.example.lock.DistributedLock;
import com.example.lock.RedisDistributedLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(
    name = "conversion.store.mode",
    havingValue = StoreProperties.MODE_REDIS,
    matchIfMissing = true)
public class RedisStoreConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  @Bean
  SharedStore sharedStore(StringRedisTemplate stringRedisTemplate, StoreProperties properties) {
    return new RedisSharedStore(stringRedisTemplate, properties.keyPrefix());
  }

  @Bean
  DistributedLock distributedLock(
      StringRedisTemplate stringRedisTemplate, StoreProperties properties) {
    return new RedisDistributedLock(stringRedisTemplate, properties.keyPrefix());
  }
}
