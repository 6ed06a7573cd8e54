package com.example.conversion.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum TaskName {
  ALL,
  PROCESS_CONVERSION,
  RECONCILIATION,
  CLEANUP;

  /** ALL で順に実行する個別タスク。 */
  public static final List<TaskName> INDIVIDUAL = List.of(PROCESS_CONVERSION, RECONCILIATION, CLEANUP);

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public String lockType() {
    return "cron:" + wireName();
  }

  public static Optional<TaskName> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (TaskName task : values()) {
      if (task.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(task);
      }
    }
    return Optional.empty();
  }
}
