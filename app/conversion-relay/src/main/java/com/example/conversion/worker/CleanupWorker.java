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
@ConditionalOnProperty(name = "conversion.tasks.cleanup-enabled", havingValue = "true")
public class CleanupWorker {

  private final ScheduledTaskService scheduledTaskService;

  @Scheduled(fixedDelayString = "${conversion.tasks.cleanup-interval}")
  public void run() {
    scheduledTaskService.run(TaskName.CLEANUP, true, TraceIds.newPrefixedId("worker"));
  }
}
