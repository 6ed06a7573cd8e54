package com.example.conversion.config;

import com.example.lock.DistributedLock;
import com.example.lock.LockManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LockConfig {

  // 起動時に生成し、シャットダウン時に延長スケジューラを止める
  @Bean(destroyMethod = "close")
  LockManager lockManager(DistributedLock distributedLock) {
    return new LockManager(distributedLock);
  }
}
