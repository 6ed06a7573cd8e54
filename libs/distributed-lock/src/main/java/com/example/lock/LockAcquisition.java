package com.example.lock;

import java.time.Duration;

/** ロック取得の結果。競合とバックエンド障害はどちらも未取得だが、呼び出し側で区別できる。 */
public record LockAcquisition(Outcome outcome, Duration remainingTtl, String reason) {

  public enum Outcome {
    ACQUIRED,
    HELD_ELSEWHERE,
    BACKEND_ERROR
  }

  public static LockAcquisition acquired(Duration ttl) {
    return new LockAcquisition(Outcome.ACQUIRED, ttl, null);
  }

  public static LockAcquisition heldElsewhere(Duration remainingTtl) {
    return new LockAcquisition(
        Outcome.HELD_ELSEWHERE,
        remainingTtl,
        "lock_held remainingMs=" + remainingTtl.toMillis());
  }

  public static LockAcquisition backendError(String reason) {
    return new LockAcquisition(Outcome.BACKEND_ERROR, Duration.ZERO, reason);
  }

  public boolean isAcquired() {
    return outcome == Outcome.ACQUIRED;
  }
}
