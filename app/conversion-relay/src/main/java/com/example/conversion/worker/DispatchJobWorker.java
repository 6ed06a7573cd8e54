/*
 * どこで: Conversion Relay 非同期配信ワーカー
 * 何を: スケジュールで process_conversion タスクを起動する
 * なぜ: 非同期モードで積まれた dispatch_jobs を一定間隔で送信するため
 */
package com.example.conversion.worker;

import com.example.common.TraceIds;
import com.example.conversion.model.TaskName;
import com.example.conversion.service.ScheduledTaskService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "conversion.dispatch.worker-enabled", havingValue = "true")
public class DispatchJobWorker {

  private final ScheduledTaskService scheduledTaskService;

  @Scheduled(fixedDelayString = "${conversion.dispatch.poll-interval}")
  public void run() {
    // ワーカーは間隔制御を @Scheduled に任せるので直近実行マーカーは無視する
    scheduledTaskService.run(TaskName.PROCESS_CONVERSION, true, TraceIds.newPrefixedId("worker"));
  }
}
