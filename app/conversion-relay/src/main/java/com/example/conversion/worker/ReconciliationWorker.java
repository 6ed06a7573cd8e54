package com.example.conversion.worker;

import com.example.common.TraceIds;
import com.example.conversion.model.TaskName;
import com.example.conversion.service.ScheduledTaskService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 全ショップの突合を定期実行する。 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "conversion.tasks.reconciliation-enabled", havingValue = "true")
public class ReconciliationWorker {

  private final ScheduledTaskService scheduledTaskService;

  @Scheduled(fixedDelayString = "${conversion.tasks.reconciliation-interval}")
  public void run() {
    scheduledTaskService.run(TaskName.RECONCILIATION, true, TraceIds.newPrefixedId("worker"));
  }
}
