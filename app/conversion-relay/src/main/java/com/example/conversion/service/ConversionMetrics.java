/*
 * どこで: Conversion Relay サービス層
 * 何を: 受信/同意除外/配信/ロック/タスクのアプリ固有メトリクスを記録する
 * なぜ: 配信失敗やロック競合を Prometheus から直接観測できるようにするため
 */
package com.example.conversion.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ConversionMetrics {

  private static final String METRIC_INGEST_TOTAL = "conversion.ingest.total";
  private static final String METRIC_INGEST_REJECTED = "conversion.ingest.rejected";
  private static final String METRIC_INGEST_ANOMALY = "conversion.ingest.anomaly";
  private static final String METRIC_CONSENT_SKIPPED = "conversion.consent.skipped";
  private static final String METRIC_DELIVERY_TOTAL = "conversion.delivery.total";
  private static final String METRIC_DELIVERY_LATENCY = "conversion.delivery.latency";
  private static final String METRIC_LOCK_TOTAL = "conversion.lock.total";
  private static final String METRIC_TASK_TOTAL = "conversion.task.total";
  private static final String METRIC_DISPATCH_BACKLOG = "conversion.dispatch.backlog";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger dispatchBacklog = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

  public ConversionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_DISPATCH_BACKLOG, dispatchBacklog, AtomicInteger::get)
        .description("Current number of queued dispatch jobs")
        .register(meterRegistry);
  }

  public void recordIngest(String result) {
    increment(METRIC_INGEST_TOTAL, "Ingest request outcomes", Tags.of("result", result));
  }

  public void recordRejected(String reason) {
    increment(METRIC_INGEST_REJECTED, "Rejected ingest requests", Tags.of("reason", reason));
  }

  public void recordAnomaly(String reason) {
    increment(METRIC_INGEST_ANOMALY, "Signed batches flagged as abusive", Tags.of("reason", reason));
  }

  public void recordConsentSkipped(String platform, String reason) {
    increment(
        METRIC_CONSENT_SKIPPED,
        "Platforms excluded by consent",
        Tags.of("platform", platform, "reason", reason));
  }

  public void recordDelivery(String platform, String status, Duration latency) {
    increment(
        METRIC_DELIVERY_TOTAL,
        "Platform delivery attempts",
        Tags.of("platform", platform, "status", status));
    latencyTimers
        .computeIfAbsent(
            platform,
            ignored ->
                Timer.builder(METRIC_DELIVERY_LATENCY)
                    .description("Platform call latency")
                    .tags(Tags.of("platform", platform))
                    .register(meterRegistry))
        .record(latency);
  }

  public void recordLock(String lock, String outcome) {
    increment(METRIC_LOCK_TOTAL, "Lock acquisition outcomes", Tags.of("lock", lock, "outcome", outcome));
  }

  public void recordTask(String task, String outcome) {
    increment(METRIC_TASK_TOTAL, "Scheduled task outcomes", Tags.of("task", task, "outcome", outcome));
  }

  public void updateDispatchBacklog(int backlog) {
    dispatchBacklog.set(Math.max(backlog, 0));
  }

  private void increment(String name, String description, Tags tags) {
    counters
        .computeIfAbsent(
            name + tags,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
