/*
 * どこで: Conversion Relay 配信サービス
 * 何を: 同期配信、非同期ジョブの登録、ジョブのバッチ処理とリトライを担う
 * なぜ: 外部 API の障害を受信処理から切り離し、試行ごとに台帳へ残すため
 */
package com.example.conversion.service.dispatch;

import com.example.common.Digests;
import com.example.conversion.config.DispatchProperties;
import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.DeliveryStatus;
import com.example.conversion.model.DispatchJob;
import com.example.conversion.model.EventReceipt;
import com.example.conversion.model.PlatformConfig;
import com.example.conversion.repository.DispatchJobRepository;
import com.example.conversion.repository.PlatformConfigRepository;
import com.example.conversion.service.ConversionMetrics;
import com.example.conversion.service.DeliveryLedger;
import com.example.lock.LockManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DispatchService {

  private static final Logger logger = LoggerFactory.getLogger(DispatchService.class);

  private final DispatchRouter router;
  private final DeliveryLedger ledger;
  private final DispatchJobRepository dispatchJobRepository;
  private final PlatformConfigRepository platformConfigRepository;
  private final DispatchProperties properties;
  private final ConversionMetrics metrics;
  private final Clock clock;
  private final String workerId;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public DispatchService(
      DispatchRouter router,
      DeliveryLedger ledger,
      DispatchJobRepository dispatchJobRepository,
      PlatformConfigRepository platformConfigRepository,
      DispatchProperties properties,
      ConversionMetrics metrics,
      Clock clock,
      ObjectMapper objectMapper,
      LockManager lockManager) {
    this.router = router;
    this.ledger = ledger;
    this.dispatchJobRepository = dispatchJobRepository;
    this.platformConfigRepository = platformConfigRepository;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.objectMapper = objectMapper;
    this.workerId = lockManager.instanceId();
  }

  /**
   * 含まれたプラットフォームへ即時に 1 回ずつ送信する。失敗してもこの場ではリトライしない。
   *
   * @return プラットフォーム名から ok/fail への写像（入力順）
   */
  public Map<String, String> dispatchNow(
      UUID receiptId, UUID shopId, ConversionEvent event, List<PlatformConfig> included) {
    final Map<String, String> deliveries = new LinkedHashMap<>();
    for (PlatformConfig config : included) {
      final Instant attemptedAt = Instant.now(clock);
      final DeliveryResult result = router.dispatch(event, config.toCredentials());
      final DeliveryStatus status = result.ok() ? DeliveryStatus.OK : DeliveryStatus.FAIL;
      ledger.recordAttempt(receiptId, shopId, event, config.platform(), status, result, attemptedAt);
      deliveries.put(config.platform().wireName(), status.dbValue());
    }
    return deliveries;
  }

  /**
   * レシートとプラットフォームごとの dispatch_jobs を同じトランザクションで書き込む。
   *
   * <p>どちらかが失敗すればレシートも残らないため、再送はもう一度ジョブ登録まで進める。
   *
   * @return 登録したプラットフォーム名から pending への写像。レシートが既にあれば empty
   */
  @Transactional
  public Optional<Map<String, String>> enqueueWithReceipt(
      EventReceipt receipt, ConversionEvent event, List<PlatformConfig> included) {
    if (!ledger.recordReceipt(receipt)) {
      return Optional.empty();
    }
    final String payloadJson = writePayload(event);
    final Instant now = Instant.now(clock);
    final Map<String, String> deliveries = new LinkedHashMap<>();
    for (PlatformConfig config : included) {
      dispatchJobRepository.insert(
          UUID.randomUUID(), receipt.id(), receipt.shopId(), config.platform(), payloadJson, now);
      deliveries.put(config.platform().wireName(), DeliveryStatus.PENDING.dbValue());
    }
    return Optional.of(deliveries);
  }

  /** 期限の来たジョブを claim して送信する。lease 切れの PROCESSING も回収対象。 */
  public DispatchBatchResult processPendingJobs() {
    final Instant now = Instant.now(clock);
    final Instant leaseUntil = now.plus(properties.lease());
    final List<DispatchJob> jobs =
        dispatchJobRepository.claimDue(properties.batchSize(), now, leaseUntil, workerId);
    int delivered = 0;
    int retried = 0;
    int failed = 0;
    for (DispatchJob job : jobs) {
      switch (processJob(job)) {
        case DELIVERED -> delivered++;
        case RETRY_SCHEDULED -> retried++;
        case FAILED -> failed++;
        case LOCK_LOST -> logger.warn("dispatch job lock lost id={}", job.id());
      }
    }
    metrics.updateDispatchBacklog(dispatchJobRepository.countPending());
    if (!jobs.isEmpty()) {
      logger.info(
          "dispatch batch processed claimed={} delivered={} retried={} failed={}",
          jobs.size(),
          delivered,
          retried,
          failed);
    }
    return new DispatchBatchResult(jobs.size(), delivered, retried, failed);
  }

  @VisibleForTesting
  JobOutcome processJob(DispatchJob job) {
    final Instant attemptedAt = Instant.now(clock);
    final int nextAttempt = job.attemptCount() + 1;
    final ConversionEvent event;
    try {
      event = objectMapper.readValue(job.payloadJson(), ConversionEvent.class);
    } catch (JsonProcessingException ex) {
      // 壊れたペイロードは何度読んでも同じなので即 FAILED にする
      logger.error("dispatch job payload unreadable id={}", job.id(), ex);
      return dispatchJobRepository.markFailed(job.id(), nextAttempt, attemptedAt, workerId) == 0
          ? JobOutcome.LOCK_LOST
          : JobOutcome.FAILED;
    }
    final Optional<PlatformConfig> config =
        platformConfigRepository
            .findByShopAndPlatform(job.shopId(), job.platform())
            .filter(PlatformConfig::active)
            .filter(PlatformConfig::serverSideEnabled);
    final DeliveryResult result =
        config.isPresent()
            ? router.dispatch(event, config.get().toCredentials())
            : DeliveryResult.failure(null, "platform_config_missing", null);
    final Instant now = Instant.now(clock);

    if (result.ok()) {
      ledger.recordAttempt(
          job.receiptId(), job.shopId(), event, job.platform(), DeliveryStatus.OK, result, attemptedAt);
      return dispatchJobRepository.markDone(job.id(), nextAttempt, now, workerId) == 0
          ? JobOutcome.LOCK_LOST
          : JobOutcome.DELIVERED;
    }
    final boolean exhausted = config.isEmpty() || nextAttempt >= properties.maxAttempts();
    if (exhausted) {
      ledger.recordAttempt(
          job.receiptId(), job.shopId(), event, job.platform(), DeliveryStatus.FAIL, result, attemptedAt);
      logger.warn(
          "dispatch job failed permanently id={} platform={} attempt={} orderKey={}",
          job.id(),
          job.platform().wireName(),
          nextAttempt,
          Digests.logSafe(event.orderKey()));
      return dispatchJobRepository.markFailed(job.id(), nextAttempt, now, workerId) == 0
          ? JobOutcome.LOCK_LOST
          : JobOutcome.FAILED;
    }
    ledger.recordAttempt(
        job.receiptId(), job.shopId(), event, job.platform(), DeliveryStatus.RETRYING, result, attemptedAt);
    final Instant nextRetryAt = now.plus(computeBackoffDuration(nextAttempt));
    return dispatchJobRepository.markRetry(job.id(), nextAttempt, nextRetryAt, now, workerId) == 0
        ? JobOutcome.LOCK_LOST
        : JobOutcome.RETRY_SCHEDULED;
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), backoffMillis));
  }

  private String writePayload(ConversionEvent event) {
    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize conversion event", ex);
    }
  }

  @VisibleForTesting
  enum JobOutcome {
    DELIVERED,
    RETRY_SCHEDULED,
    FAILED,
    LOCK_LOST
  }

  /** 1 バッチ分の処理件数。 */
  public record DispatchBatchResult(int claimed, int delivered, int retried, int failed) {

    public Map<String, Object> toMap() {
      return Map.of("claimed", claimed, "delivered", delivered, "retried", retried, "failed", failed);
    }
  }
}
