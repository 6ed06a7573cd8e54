/*
 * どこで: Conversion Relay 定期タスク
 * 何を: タスクごとの分散ロックと「直近実行済み」マーカーの下で保守処理を実行する
 * なぜ: cron 起動とワーカー起動が複数インスタンスで重複実行されないようにするため
 *
 * 実行時間は task-timeout で打ち切る。ロックは延長され続けるため、上限が無いと停止したタスクが
 * ロックを握り続ける。
 */
package com.example.conversion.service;

import com.example.conversion.config.TaskProperties;
import com.example.conversion.model.TaskName;
import com.example.conversion.model.TaskOutcome;
import com.example.conversion.service.dispatch.DispatchService;
import com.example.lock.LockAcquisition;
import com.example.lock.LockLease;
import com.example.lock.LockManager;
import com.example.lock.LockManager.LeaseResult;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class ScheduledTaskService {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledTaskService.class);

  private final LockManager lockManager;
  private final SharedStore sharedStore;
  private final DispatchService dispatchService;
  private final ReconciliationService reconciliationService;
  private final CleanupService cleanupService;
  private final ConversionMetrics metrics;
  private final TaskProperties properties;
  private final Clock clock;
  private final AsyncTaskExecutor taskRunnerExecutor;

  public ScheduledTaskService(
      LockManager lockManager,
      SharedStore sharedStore,
      DispatchService dispatchService,
      ReconciliationService reconciliationService,
      CleanupService cleanupService,
      ConversionMetrics metrics,
      TaskProperties properties,
      Clock clock,
      @Qualifier("taskRunnerExecutor") AsyncTaskExecutor taskRunnerExecutor) {
    this.lockManager = lockManager;
    this.sharedStore = sharedStore;
    this.dispatchService = dispatchService;
    this.reconciliationService = reconciliationService;
    this.cleanupService = cleanupService;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
    this.taskRunnerExecutor = taskRunnerExecutor;
  }

  /**
   * タスクを実行する。ALL は個別タスクをそれぞれのロックで順に実行し、結果をまとめる。
   *
   * @param force true なら直近実行済みマーカーを無視する（ロックは常に取る）
   * @param requestId ロック保持者トークンの一部。ログから起動元を辿るため
   */
  public TaskOutcome run(TaskName task, boolean force, String requestId) {
    if (task != TaskName.ALL) {
      return runSingle(task, force, requestId);
    }
    final Map<String, Object> results = new LinkedHashMap<>();
    TaskOutcome.Status worst = TaskOutcome.Status.SKIPPED;
    for (TaskName individual : TaskName.INDIVIDUAL) {
      final TaskOutcome outcome = runSingle(individual, force, requestId);
      results.put(individual.wireName(), summarize(outcome));
      worst = worse(worst, outcome.status());
    }
    final String reason =
        switch (worst) {
          case FAILED -> "task_failed";
          case BACKEND_ERROR -> "lock_backend_error";
          case SKIPPED -> "all_skipped";
          case COMPLETED -> null;
        };
    return new TaskOutcome(TaskName.ALL, worst, reason, null, results);
  }

  private TaskOutcome runSingle(TaskName task, boolean force, String requestId) {
    final String holderToken = lockManager.instanceId() + "-" + requestId;
    final LeaseResult leaseResult =
        lockManager.tryLease(task.lockType(), holderToken, properties.lockTtl());
    final LockAcquisition acquisition = leaseResult.acquisition();
    metrics.recordLock(task.lockType(), acquisition.outcome().name().toLowerCase(Locale.ROOT));
    if (!leaseResult.acquired()) {
      final TaskOutcome outcome =
          acquisition.outcome() == LockAcquisition.Outcome.BACKEND_ERROR
              ? TaskOutcome.backendError(task, acquisition.reason())
              : TaskOutcome.lockHeld(task, acquisition.remainingTtl().toMillis());
      logger.info(
          "task not run task={} status={} reason={}", task.wireName(), outcome.status(), outcome.reason());
      return record(outcome);
    }
    try (LockLease lease = leaseResult.lease()) {
      final String marker = "task:lastrun:" + task.wireName();
      if (!force && sharedStore.exists(marker)) {
        return record(TaskOutcome.recentlyRun(task));
      }
      final TaskOutcome outcome = execute(task);
      if (outcome.status() == TaskOutcome.Status.COMPLETED) {
        sharedStore.set(marker, String.valueOf(clock.millis()), properties.minInterval());
      }
      if (lease.isLost()) {
        logger.warn("task finished after lock was lost task={} holder={}", task.wireName(), holderToken);
      }
      return record(outcome);
    } catch (DataAccessException ex) {
      // マーカー参照/更新の失敗はロックストア障害と同じく fail-closed
      logger.error("task marker store failed task={}", task.wireName(), ex);
      return record(TaskOutcome.backendError(task, ex.getClass().getSimpleName()));
    }
  }

  private TaskOutcome execute(TaskName task) {
    final long startedAt = clock.millis();
    final Future<Map<String, Object>> future;
    try {
      future = taskRunnerExecutor.submit(() -> invoke(task));
    } catch (TaskRejectedException ex) {
      logger.error("task rejected by runner pool task={}", task.wireName(), ex);
      return TaskOutcome.failed(task, "task_rejected");
    }
    final long timeoutMs = properties.taskTimeout().toMillis();
    try {
      final Map<String, Object> result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
      logger.info("task completed task={} durationMs={}", task.wireName(), clock.millis() - startedAt);
      return TaskOutcome.completed(task, result);
    } catch (TimeoutException ex) {
      // 割り込みに応じないタスクでも、ここで戻ればロックは解放される
      future.cancel(true);
      logger.error("task timed out task={} timeoutMs={}", task.wireName(), timeoutMs, ex);
      return TaskOutcome.failed(task, "task_timeout");
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      logger.error("task failed task={}", task.wireName(), cause);
      return TaskOutcome.failed(task, cause.getClass().getSimpleName());
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      logger.warn("interrupted while waiting for task task={}", task.wireName(), ex);
      return TaskOutcome.failed(task, "interrupted");
    }
  }

  private Map<String, Object> invoke(TaskName task) {
    return switch (task) {
      case PROCESS_CONVERSION -> dispatchService.processPendingJobs().toMap();
      case RECONCILIATION -> reconciliationService.runForAllShops();
      case CLEANUP -> cleanupService.cleanup();
      case ALL -> throw new IllegalArgumentException("ALL is not an individual task");
    };
  }

  private TaskOutcome record(TaskOutcome outcome) {
    metrics.recordTask(outcome.task().wireName(), outcome.status().name().toLowerCase(Locale.ROOT));
    return outcome;
  }

  private static Map<String, Object> summarize(TaskOutcome outcome) {
    final Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
    if (outcome.reason() != null) {
      summary.put("reason", outcome.reason());
    }
    if (outcome.remainingMs() != null) {
      summary.put("remaining_ms", outcome.remainingMs());
    }
    if (!outcome.result().isEmpty()) {
      summary.put("result", outcome.result());
    }
    return summary;
  }

  /** FAILED > BACKEND_ERROR > COMPLETED > SKIPPED の順に悪いものを残す。 */
  private static TaskOutcome.Status worse(TaskOutcome.Status current, TaskOutcome.Status next) {
    return rank(next) > rank(current) ? next : current;
  }

  private static int rank(TaskOutcome.Status status) {
    return switch (status) {
      case SKIPPED -> 0;
      case COMPLETED -> 1;
      case BACKEND_ERROR -> 2;
      case FAILED -> 3;
    };
  }
}
