package com.example.conversion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

  /** cron の mode=async で受け付けたタスクを実行する。 */
  @Bean
  ThreadPoolTaskExecutor taskTriggerExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(10);
    executor.setThreadNamePrefix("task-trigger-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }

  /**
   * 定期タスク本体を実行する。呼び出し側はタイムアウト付きで結果を待ち、打ち切ったスレッドは割り込む。
   * キューを持たず、割り込みに応じないタスクが残っていても別タスクはスレッドを増やして走らせる。
   */
  @Bean
  ThreadPoolTaskExecutor taskRunnerExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(3);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("task-runner-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
