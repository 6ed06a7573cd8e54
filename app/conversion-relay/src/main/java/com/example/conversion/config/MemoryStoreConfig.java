/*
 * どこで: Conversion Relay インフラ設定
 * 何を: プロセス内の共有ストアと分散ロックを提供する
 * なぜ: 単一インスタンス/開発環境で Redis なしに起動するため
 */
package com.example.conversion.config;

import com.example.conversion.service.InMemorySharedStore;
import com.example.conversion.service.SharedStore;
import com.example.lock.DistributedLock;
import com.example.lock.InMemoryDistributedLock;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "conversion.store.mode", havingValue = StoreProperties.MODE_MEMORY)
public class MemoryStoreConfig {

  private static final Logger logger = LoggerFactory.getLogger(MemoryStoreConfig.class);

  @Bean
  SharedStore sharedStore(Clock clock) {
    logger.warn("in-memory shared store is active; nonce and lock state is not shared across instances");
    return new InMemorySharedStore(clock);
  }

  @Bean
  DistributedLock distributedLock(Clock clock) {
    return new InMemoryDistributedLock(clock);
  }
}
