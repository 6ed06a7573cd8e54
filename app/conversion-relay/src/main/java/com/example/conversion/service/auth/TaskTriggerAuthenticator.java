/*
 * どこで: Conversion Relay 認証（タスク起動エンドポイント）
 * 何を: Bearer シークレット（旧シークレット猶予付き）と署名付きタイムスタンプを検証する
 * なぜ: 外部スケジューラ以外からの起動と同一リクエストの再送を防ぐため
 */
package com.example.conversion.service.auth;

import com.example.common.Digests;
import com.example.conversion.config.TaskProperties;
import com.example.conversion.service.SharedStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TaskTriggerAuthenticator {

  private static final Logger logger = LoggerFactory.getLogger(TaskTriggerAuthenticator.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final TaskProperties properties;
  private final SharedStore sharedStore;
  private final Clock clock;

  public TaskAuthResult authenticate(String authorization, String timestamp, String signature) {
    final String secret = properties.secret();
    if (secret.isBlank()) {
      return TaskAuthResult.reject(TaskAuthResult.Status.NOT_CONFIGURED, "cron_secret_not_configured");
    }
    if (secret.length() < properties.minSecretLength()) {
      logger.error("cron secret is shorter than {} characters; refusing to run tasks", properties.minSecretLength());
      return TaskAuthResult.reject(TaskAuthResult.Status.NOT_CONFIGURED, "cron_secret_too_short");
    }
    if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
      return TaskAuthResult.reject(TaskAuthResult.Status.UNAUTHORIZED, "missing_bearer");
    }
    final String provided = authorization.substring(BEARER_PREFIX.length()).trim();
    final String matchedSecret;
    final boolean usedPrevious;
    if (Digests.constantTimeEquals(secret, provided)) {
      matchedSecret = secret;
      usedPrevious = false;
    } else if (!properties.previousSecret().isBlank()
        && Digests.constantTimeEquals(properties.previousSecret(), provided)) {
      matchedSecret = properties.previousSecret();
      usedPrevious = true;
      logger.info("task trigger authenticated with previous cron secret");
    } else {
      return TaskAuthResult.reject(TaskAuthResult.Status.UNAUTHORIZED, "invalid_secret");
    }

    final boolean hasReplayHeaders = !isBlank(timestamp) && !isBlank(signature);
    if (!hasReplayHeaders) {
      if (properties.strictReplay()) {
        return TaskAuthResult.reject(TaskAuthResult.Status.UNAUTHORIZED, "missing_replay_headers");
      }
      return new TaskAuthResult(TaskAuthResult.Status.OK, null, usedPrevious);
    }
    return verifyReplay(matchedSecret, timestamp.trim(), signature.trim(), usedPrevious);
  }

  private TaskAuthResult verifyReplay(
      String secret, String timestamp, String signature, boolean usedPrevious) {
    final long epochSeconds;
    try {
      epochSeconds = Long.parseLong(timestamp);
    } catch (NumberFormatException ex) {
      return TaskAuthResult.reject(TaskAuthResult.Status.UNAUTHORIZED, "invalid_timestamp");
    }
    // 任意の long を Instant にせず、現在時刻からの窓と直接比べる
    final long nowSeconds = Instant.now(clock).getEpochSecond();
    final long windowSeconds = properties.replayWindow().getSeconds();
    if (epochSeconds < nowSeconds - windowSeconds || epochSeconds > nowSeconds + windowSeconds) {
      return TaskAuthResult.reject(TaskAuthResult.Status.UNAUTHORIZED, "stale_timestamp");
    }
    final String normalized = signature.toLowerCase(Locale.ROOT);
    if (!Digests.constantTimeEquals(Digests.hmacSha256Hex(secret, timestamp), normalized)) {
      return TaskAuthResult.reject(TaskAuthResult.Status.UNAUTHORIZED, "invalid_signature");
    }
    try {
      if (!sharedStore.setIfAbsent("cron:sig:" + normalized, timestamp, properties.replayWindow())) {
        return TaskAuthResult.reject(TaskAuthResult.Status.UNAUTHORIZED, "replay_detected");
      }
    } catch (DataAccessException ex) {
      logger.warn("replay store unavailable for task trigger", ex);
      return TaskAuthResult.reject(TaskAuthResult.Status.STORE_ERROR, "replay_store_error");
    }
    return new TaskAuthResult(TaskAuthResult.Status.OK, null, usedPrevious);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public record TaskAuthResult(Status status, String reason, boolean usedPreviousSecret) {

    public enum Status {
      OK,
      UNAUTHORIZED,
      NOT_CONFIGURED,
      STORE_ERROR
    }

    static TaskAuthResult reject(Status status, String reason) {
      return new TaskAuthResult(status, reason, false);
    }

    public boolean authenticated() {
      return status == Status.OK;
    }
  }
}
