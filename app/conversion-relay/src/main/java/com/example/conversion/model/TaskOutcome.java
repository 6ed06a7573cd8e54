package com.example.conversion.model;

import java.util.Map;

/** 定期タスク 1 回分の結果。ロック競合もストア障害も値で表す。 */
public record TaskOutcome(
    TaskName task, Status status, String reason, Long remainingMs, Map<String, Object> result) {

  public enum Status {
    COMPLETED,
    SKIPPED,
    BACKEND_ERROR,
    FAILED
  }

  public TaskOutcome {
    result = result == null ? Map.of() : Map.copyOf(result);
  }

  public static TaskOutcome completed(TaskName task, Map<String, Object> result) {
    return new TaskOutcome(task, Status.COMPLETED, null, null, result);
  }

  public static TaskOutcome lockHeld(TaskName task, long remainingMs) {
    return new TaskOutcome(task, Status.SKIPPED, "lock_held", remainingMs, null);
  }

  public static TaskOutcome recentlyRun(TaskName task) {
    return new TaskOutcome(task, Status.SKIPPED, "recently_run", null, null);
  }

  public static TaskOutcome backendError(TaskName task, String detail) {
    return new TaskOutcome(task, Status.BACKEND_ERROR, "lock_backend_error", null, Map.of("detail", detail));
  }

  public static TaskOutcome failed(TaskName task, String detail) {
    return new TaskOutcome(task, Status.FAILED, "task_failed", null, Map.of("detail", detail));
  }
}
