/*
 * どこで: Conversion Relay 保守タスク
 * 何を: 期限切れの event_nonces と完了済み dispatch_jobs を削除する
 * なぜ: リプレイ防止と非同期配信のテーブルを無制限に増やさないため
 */
package com.example.conversion.service;

import com.example.conversion.config.TaskProperties;
import com.example.conversion.repository.DispatchJobRepository;
import com.example.conversion.repository.EventNonceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CleanupService {

  private static final Logger logger = LoggerFactory.getLogger(CleanupService.class);
  private static final int MAX_ROUNDS = 100;

  private final EventNonceRepository eventNonceRepository;
  private final DispatchJobRepository dispatchJobRepository;
  private final TaskProperties properties;
  private final Clock clock;

  public Map<String, Object> cleanup() {
    final Instant now = Instant.now(clock);
    int deletedNonces = 0;
    // 1 回の DELETE を小さく保ち、長いロックを避ける
    for (int round = 0; round < MAX_ROUNDS; round++) {
      final int deleted = eventNonceRepository.deleteExpired(now, properties.cleanupBatchSize());
      deletedNonces += deleted;
      if (deleted < properties.cleanupBatchSize()) {
        break;
      }
    }
    final Instant jobThreshold = now.minus(properties.completedJobRetention());
    final int deletedJobs = dispatchJobRepository.deleteFinishedOlderThan(jobThreshold);
    logger.info(
        "cleanup deleted nonces={} dispatchJobs={} jobThreshold={}",
        deletedNonces,
        deletedJobs,
        jobThreshold);
    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("deleted_nonces", deletedNonces);
    result.put("deleted_dispatch_jobs", deletedJobs);
    return result;
  }
}
