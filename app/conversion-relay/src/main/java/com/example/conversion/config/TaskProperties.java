/*
 * どこで: Conversion Relay の設定バインド
 * 何を: 定期タスク（cron 起動/ワーカー）の認証・ロック・間隔設定を保持する
 * なぜ: 複数インスタンス運用時のタスク制御を外部化するため
 */
package com.example.conversion.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "conversion.tasks")
public record TaskProperties(
    String secret,
    String previousSecret,
    boolean strictReplay,
    Duration replayWindow,
    Duration lockTtl,
    int minSecretLength,
    Duration minInterval,
    Duration reconciliationWindow,
    Duration timingDelayThreshold,
    int cleanupBatchSize,
    Duration completedJobRetention,
    Duration taskTimeout) {

  public TaskProperties {
    secret = secret == null ? "" : secret;
    previousSecret = previousSecret == null ? "" : previousSecret;
    replayWindow = replayWindow == null ? Duration.ofMinutes(5) : replayWindow;
    lockTtl = lockTtl == null ? Duration.ofMinutes(10) : lockTtl;
    minSecretLength = minSecretLength <= 0 ? 32 : minSecretLength;
    minInterval = minInterval == null ? Duration.ofMinutes(1) : minInterval;
    reconciliationWindow =
        reconciliationWindow == null ? Duration.ofHours(24) : reconciliationWindow;
    timingDelayThreshold =
        timingDelayThreshold == null ? Duration.ofMinutes(5) : timingDelayThreshold;
    cleanupBatchSize = cleanupBatchSize <= 0 ? 1000 : cleanupBatchSize;
    completedJobRetention =
        completedJobRetention == null ? Duration.ofDays(7) : completedJobRetention;
    taskTimeout = taskTimeout == null ? Duration.ofMinutes(30) : taskTimeout;
  }
}
